package io.veomenu.backend.multitenancy;

public class TenantContextNotBoundException extends RuntimeException {

  public TenantContextNotBoundException() {
    super("Tenant context not available: not bound by filter chain");
  }
}
