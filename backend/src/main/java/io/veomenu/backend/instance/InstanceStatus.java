package io.veomenu.backend.instance;

/** Subscription state of an instance. Suspended and cancelled instances are closed to members. */
public enum InstanceStatus {
  TRIAL,
  ACTIVE,
  EXPIRED,
  SUSPENDED,
  CANCELLED;

  public boolean allowsAccess() {
    return this != SUSPENDED && this != CANCELLED;
  }
}
