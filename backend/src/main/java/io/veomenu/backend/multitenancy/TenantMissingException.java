package io.veomenu.backend.multitenancy;

public class TenantMissingException extends TenantAccessException {

  public TenantMissingException() {
    super("no " + TenantResolver.TENANT_HEADER + " header");
  }
}
