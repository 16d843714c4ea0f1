package io.veomenu.backend.instance;

import io.veomenu.backend.exception.ResourceNotFoundException;
import io.veomenu.backend.multitenancy.TenantContext;
import java.text.Normalizer;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class InstanceService {

  private static final Logger log = LoggerFactory.getLogger(InstanceService.class);
  private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
  private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");
  private static final int MAX_SLUG_BASE = 90;

  private final InstanceRepository instanceRepository;
  private final InstanceMembershipRepository membershipRepository;
  private final Clock clock;

  public InstanceService(
      InstanceRepository instanceRepository,
      InstanceMembershipRepository membershipRepository,
      Clock clock) {
    this.instanceRepository = instanceRepository;
    this.membershipRepository = membershipRepository;
    this.clock = clock;
  }

  /** Creates an instance in trial status with the creator as its owner. */
  @Transactional
  public MembershipSummary createInstance(UUID ownerId, String name) {
    Instant now = clock.instant();
    String trimmed = name.trim();
    var instance = instanceRepository.save(new Instance(trimmed, uniqueSlug(trimmed), now));
    membershipRepository.save(
        new InstanceMembership(ownerId, instance.getId(), MembershipRole.OWNER, now));

    log.info(
        "Created instance {} ({}) owned by user {}", instance.getId(), instance.getSlug(), ownerId);
    return new MembershipSummary(
        instance.getId(),
        instance.getName(),
        instance.getSlug(),
        instance.getStatus(),
        MembershipRole.OWNER);
  }

  @Transactional(readOnly = true)
  public List<MembershipSummary> listInstancesForUser(UUID userId) {
    return membershipRepository.findSummariesByUserId(userId);
  }

  /** The current tenant as seen by the caller. */
  @Transactional(readOnly = true)
  public MembershipSummary getCurrentInstance(TenantContext tenant) {
    return membershipRepository
        .findSummary(tenant.userId(), tenant.instanceId())
        .orElseThrow(() -> new ResourceNotFoundException("Instance", tenant.instanceId()));
  }

  static String slugify(String name) {
    String decomposed = Normalizer.normalize(name, Normalizer.Form.NFD);
    String ascii = DIACRITICS.matcher(decomposed).replaceAll("");
    String slug = NON_SLUG.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("-");
    slug = slug.replaceAll("^-+|-+$", "");
    if (slug.length() > MAX_SLUG_BASE) {
      slug = slug.substring(0, MAX_SLUG_BASE).replaceAll("-+$", "");
    }
    return slug.isEmpty() ? "instance" : slug;
  }

  private String uniqueSlug(String name) {
    String base = slugify(name);
    String candidate = base;
    int suffix = 2;
    while (instanceRepository.existsBySlug(candidate)) {
      candidate = base + "-" + suffix++;
    }
    return candidate;
  }
}
