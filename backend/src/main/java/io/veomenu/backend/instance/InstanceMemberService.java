package io.veomenu.backend.instance;

import io.veomenu.backend.auth.PendingRegistration;
import io.veomenu.backend.exception.ForbiddenException;
import io.veomenu.backend.exception.ResourceConflictException;
import io.veomenu.backend.exception.ResourceNotFoundException;
import io.veomenu.backend.multitenancy.TenantContext;
import io.veomenu.backend.user.UserRepository;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Membership management inside the current tenant. Every read and write is keyed by {@link
 * TenantContext#instanceId()}; members of other instances are indistinguishable from unknown
 * users.
 */
@Service
public class InstanceMemberService {

  private static final Logger log = LoggerFactory.getLogger(InstanceMemberService.class);

  private final InstanceMembershipRepository membershipRepository;
  private final UserRepository userRepository;
  private final Clock clock;

  public InstanceMemberService(
      InstanceMembershipRepository membershipRepository,
      UserRepository userRepository,
      Clock clock) {
    this.membershipRepository = membershipRepository;
    this.userRepository = userRepository;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public List<MemberView> listMembers(TenantContext tenant) {
    tenant.requireRole(MembershipRole.MANAGER);
    return membershipRepository.findMembers(tenant.instanceId());
  }

  /**
   * Adds an existing account to the tenant.
   *
   * @throws ResourceNotFoundException if no account uses the email
   * @throws ResourceConflictException if the account is already a member
   */
  @Transactional
  public MemberView addMember(TenantContext tenant, String email, MembershipRole role) {
    tenant.requireRole(MembershipRole.ADMIN);
    requireAssignable(role);

    var user =
        userRepository
            .findByEmail(PendingRegistration.normalizeEmail(email))
            .orElseThrow(() -> ResourceNotFoundException.byEmail("User"));
    if (membershipRepository.existsByUserIdAndInstanceId(user.getId(), tenant.instanceId())) {
      throw ResourceConflictException.alreadyMember();
    }

    var membership =
        membershipRepository.save(
            new InstanceMembership(user.getId(), tenant.instanceId(), role, clock.instant()));
    log.info("Added user {} to instance {} as {}", user.getId(), tenant.instanceId(), role);
    return new MemberView(
        user.getId(), user.getEmail(), user.getName(), role, membership.getJoinedAt());
  }

  @Transactional
  public void changeRole(TenantContext tenant, UUID userId, MembershipRole role) {
    tenant.requireRole(MembershipRole.ADMIN);
    requireAssignable(role);

    var membership = findMembership(tenant, userId);
    if (membership.getRole() == MembershipRole.OWNER) {
      throw ForbiddenException.ownerImmutable("The owner's role cannot be changed");
    }
    membership.changeRole(role);
    log.info("Changed role of user {} in instance {} to {}", userId, tenant.instanceId(), role);
  }

  @Transactional
  public void removeMember(TenantContext tenant, UUID userId) {
    tenant.requireRole(MembershipRole.ADMIN);

    var membership = findMembership(tenant, userId);
    if (membership.getRole() == MembershipRole.OWNER) {
      throw ForbiddenException.ownerImmutable("The owner cannot be removed");
    }
    membershipRepository.delete(membership);
    log.info("Removed user {} from instance {}", userId, tenant.instanceId());
  }

  private InstanceMembership findMembership(TenantContext tenant, UUID userId) {
    return membershipRepository
        .findByUserIdAndInstanceId(userId, tenant.instanceId())
        .orElseThrow(() -> new ResourceNotFoundException("Member", userId));
  }

  private static void requireAssignable(MembershipRole role) {
    if (role == MembershipRole.OWNER) {
      throw ForbiddenException.roleNotAssignable(role.name());
    }
  }
}
