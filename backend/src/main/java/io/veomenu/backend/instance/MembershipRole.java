package io.veomenu.backend.instance;

/** Roles within an instance, highest first. */
public enum MembershipRole {
  OWNER(4),
  ADMIN(3),
  MANAGER(2),
  STAFF(1);

  private final int rank;

  MembershipRole(int rank) {
    this.rank = rank;
  }

  public boolean isAtLeast(MembershipRole required) {
    return rank >= required.rank;
  }
}
