package io.veomenu.backend.multitenancy;

import io.veomenu.backend.exception.ForbiddenException;
import io.veomenu.backend.instance.MembershipRole;
import java.util.Objects;
import java.util.UUID;

/**
 * The tenant a request was resolved to, bound once by {@link TenantFilter}. Controllers receive it
 * as a method argument and pass it explicitly to services, which scope every query by {@link
 * #instanceId()}.
 *
 * @param instanceId the tenant
 * @param userId the authenticated caller, a member of the tenant
 * @param role the caller's role within the tenant
 */
public record TenantContext(UUID instanceId, UUID userId, MembershipRole role) {

  /** Request attribute under which the resolved context is stored. */
  public static final String REQUEST_ATTRIBUTE = TenantContext.class.getName();

  public TenantContext {
    Objects.requireNonNull(instanceId, "instanceId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(role, "role");
  }

  /**
   * @throws ForbiddenException if the caller's role ranks below {@code required}
   */
  public void requireRole(MembershipRole required) {
    if (!role.isAtLeast(required)) {
      throw ForbiddenException.insufficientRole(required.name());
    }
  }
}
