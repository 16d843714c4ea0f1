package io.veomenu.backend.auth;

import io.veomenu.backend.config.AuthProperties;
import io.veomenu.backend.security.SecureTokens;
import io.veomenu.backend.session.AuthenticationFailedException;
import io.veomenu.backend.user.User;
import io.veomenu.backend.user.UserRepository;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Generates and verifies time-limited magic link tokens. Tokens are cryptographically random,
 * stored as SHA-256 hashes in the database. Single-use enforcement via database state
 * (consumed_at column) under a row lock.
 */
@Service
public class MagicLinkService {

  private static final Logger log = LoggerFactory.getLogger(MagicLinkService.class);

  private final MagicLinkRepository linkRepository;
  private final UserRepository userRepository;
  private final AuthProperties.MagicLink policy;
  private final Clock clock;
  private final String appBaseUrl;

  public MagicLinkService(
      MagicLinkRepository linkRepository,
      UserRepository userRepository,
      AuthProperties properties,
      Clock clock,
      @Value("${veomenu.app.base-url:http://localhost:3000}") String appBaseUrl) {
    this.linkRepository = linkRepository;
    this.userRepository = userRepository;
    this.policy = properties.magicLink();
    this.clock = clock;
    this.appBaseUrl = appBaseUrl;
  }

  /**
   * Issues a magic link for the given user.
   *
   * @param createdIp the IP address of the requester (nullable)
   * @throws MagicLinkRateLimitedException if the user already requested the maximum number of
   *     links within the rate-limit window
   */
  @Transactional
  public IssuedMagicLink issue(User user, String createdIp) {
    Instant now = clock.instant();
    long recentCount =
        linkRepository.countByUserIdAndIssuedAtAfter(
            user.getId(), now.minus(policy.rateLimitWindow()));
    if (recentCount >= policy.maxPerWindow()) {
      throw new MagicLinkRateLimitedException(user.getId());
    }

    if (policy.supersedePrevious()) {
      int superseded = linkRepository.consumeOutstanding(user.getId(), now);
      log.debug("Superseded {} outstanding magic links for user {}", superseded, user.getId());
    }

    String rawToken = SecureTokens.newUrlSafeToken();
    Instant expiresAt = now.plus(policy.ttl());
    var link =
        new MagicLink(user.getId(), SecureTokens.sha256Hex(rawToken), now, expiresAt, createdIp);
    link = linkRepository.save(link);

    log.info("Issued magic link {} for user {}", link.getId(), user.getId());
    return new IssuedMagicLink(appBaseUrl + "/auth/verify?token=" + rawToken, expiresAt);
  }

  /**
   * Verifies and consumes a magic link token.
   *
   * @return the user the link was issued to
   * @throws InvalidVerificationCodeException if the token is unknown or already consumed
   * @throws ExpiredCredentialException if the link expired before use
   * @throws AuthenticationFailedException if the owning account is no longer active
   */
  @Transactional(noRollbackFor = VerificationFailedException.class)
  public User verifyAndConsume(String rawToken) {
    MagicLink link =
        linkRepository
            .findByTokenHashForUpdate(SecureTokens.sha256Hex(rawToken))
            .orElseThrow(InvalidVerificationCodeException::invalidMagicLink);

    if (link.isConsumed()) {
      throw InvalidVerificationCodeException.invalidMagicLink();
    }
    Instant now = clock.instant();
    if (link.isExpired(now)) {
      throw new ExpiredCredentialException("magic link");
    }

    User user =
        userRepository
            .findById(link.getUserId())
            .filter(User::isActive)
            .orElseThrow(
                () -> new AuthenticationFailedException("inactive user " + link.getUserId()));

    link.markConsumed(now);
    log.debug("Consumed magic link {} for user {}", link.getId(), user.getId());
    return user;
  }
}
