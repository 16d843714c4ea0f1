package io.veomenu.backend.multitenancy;

public class TenantMismatchException extends TenantAccessException {

  public TenantMismatchException(String reason) {
    super(reason);
  }
}
