package io.veomenu.backend.auth;

import io.veomenu.backend.config.CleanupProperties;
import io.veomenu.backend.session.UserSessionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Scheduled cleanup of expired credentials. Runs hourly and removes magic links, registration
 * challenges, phone codes and sessions that expired more than the retention window ago.
 */
@Component
public class CredentialCleanupService {

  private static final Logger log = LoggerFactory.getLogger(CredentialCleanupService.class);

  private final MagicLinkRepository linkRepository;
  private final OtpChallengeRepository challengeRepository;
  private final PhoneVerificationRepository phoneVerificationRepository;
  private final UserSessionRepository sessionRepository;
  private final TransactionTemplate transactionTemplate;
  private final CleanupProperties properties;
  private final Clock clock;

  public CredentialCleanupService(
      MagicLinkRepository linkRepository,
      OtpChallengeRepository challengeRepository,
      PhoneVerificationRepository phoneVerificationRepository,
      UserSessionRepository sessionRepository,
      TransactionTemplate transactionTemplate,
      CleanupProperties properties,
      Clock clock) {
    this.linkRepository = linkRepository;
    this.challengeRepository = challengeRepository;
    this.phoneVerificationRepository = phoneVerificationRepository;
    this.sessionRepository = sessionRepository;
    this.transactionTemplate = transactionTemplate;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(fixedRate = 3600000) // hourly
  public void cleanupExpiredCredentials() {
    if (!properties.enabled()) {
      return;
    }
    Instant cutoff = clock.instant().minus(properties.retention());

    int links = purge("magic links", cutoff, linkRepository::deleteExpiredBefore);
    int challenges =
        purge("registration challenges", cutoff, challengeRepository::deleteExpiredBefore);
    int phoneCodes =
        purge("phone codes", cutoff, phoneVerificationRepository::deleteExpiredBefore);
    int sessions = purge("sessions", cutoff, sessionRepository::deleteExpiredBefore);

    if (links + challenges + phoneCodes + sessions > 0) {
      log.info(
          "Cleaned up {} magic links, {} registration challenges, {} phone codes and {} sessions"
              + " expired before {}",
          links,
          challenges,
          phoneCodes,
          sessions,
          cutoff);
    }
  }

  private int purge(String what, Instant cutoff, Function<Instant, Integer> delete) {
    try {
      Integer deleted = transactionTemplate.execute(status -> delete.apply(cutoff));
      return deleted != null ? deleted : 0;
    } catch (RuntimeException e) {
      log.warn("Failed to clean up expired {}: {}", what, e.getMessage());
      return 0;
    }
  }
}
