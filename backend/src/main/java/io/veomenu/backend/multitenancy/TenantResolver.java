package io.veomenu.backend.multitenancy;

import io.veomenu.backend.instance.InstanceMembershipRepository;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Turns a caller and a requested tenant identifier into a {@link TenantContext}. */
@Component
public class TenantResolver {

  public static final String TENANT_HEADER = "X-Instance-Id";

  private final InstanceMembershipRepository membershipRepository;

  public TenantResolver(InstanceMembershipRepository membershipRepository) {
    this.membershipRepository = membershipRepository;
  }

  /**
   * Resolves the caller's membership in the requested instance.
   *
   * @param userId the authenticated caller
   * @param requestedInstanceId raw header value, may be null
   * @throws TenantMissingException if no instance was requested
   * @throws TenantMismatchException if the id is malformed, unknown, or not one of the caller's
   * @throws TenantSuspendedException if the instance is closed
   */
  @Transactional(readOnly = true)
  public TenantContext resolve(UUID userId, String requestedInstanceId) {
    if (requestedInstanceId == null || requestedInstanceId.isBlank()) {
      throw new TenantMissingException();
    }

    UUID instanceId;
    try {
      instanceId = UUID.fromString(requestedInstanceId.trim());
    } catch (IllegalArgumentException e) {
      throw new TenantMismatchException("malformed instance id");
    }

    var membership =
        membershipRepository
            .findSummary(userId, instanceId)
            .orElseThrow(
                () ->
                    new TenantMismatchException(
                        "user " + userId + " is not a member of instance " + instanceId));

    if (!membership.status().allowsAccess()) {
      throw new TenantSuspendedException(instanceId, membership.status());
    }
    return new TenantContext(instanceId, userId, membership.role());
  }
}
