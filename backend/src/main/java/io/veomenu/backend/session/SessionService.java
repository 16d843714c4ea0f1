package io.veomenu.backend.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.veomenu.backend.config.AuthProperties;
import io.veomenu.backend.exception.ResourceNotFoundException;
import io.veomenu.backend.security.SecureTokens;
import io.veomenu.backend.user.User;
import io.veomenu.backend.user.UserRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Creates, refreshes and revokes login sessions. Each session pairs a self-contained access token
 * with an opaque refresh token whose hash lives on the {@link UserSession} row, so refresh and
 * revocation always go through the store.
 */
@Service
public class SessionService {

  private static final Logger log = LoggerFactory.getLogger(SessionService.class);

  private final UserSessionRepository sessionRepository;
  private final UserRepository userRepository;
  private final SessionTokenService tokenService;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;
  private final Duration refreshTtl;
  private final Cache<UUID, Boolean> activeSessions;

  public SessionService(
      UserSessionRepository sessionRepository,
      UserRepository userRepository,
      SessionTokenService tokenService,
      TransactionTemplate transactionTemplate,
      AuthProperties properties,
      Clock clock) {
    this.sessionRepository = sessionRepository;
    this.userRepository = userRepository;
    this.tokenService = tokenService;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
    this.refreshTtl = properties.session().refreshTtl();
    this.activeSessions =
        Caffeine.newBuilder()
            .maximumSize(100_000)
            .expireAfterWrite(properties.session().activityCacheTtl())
            .build();
  }

  /**
   * Starts a session for a verified user.
   *
   * @return access and refresh credentials bound to the new session
   */
  @Transactional
  public SessionTokens createSession(User user, DeviceMetadata device) {
    Instant now = clock.instant();
    String refreshToken = SecureTokens.newUrlSafeToken();

    var session =
        new UserSession(
            user.getId(),
            SecureTokens.sha256Hex(refreshToken),
            device,
            now,
            now.plus(refreshTtl));
    session = sessionRepository.save(session);

    userRepository.findById(user.getId()).ifPresent(u -> u.recordLogin(now));

    log.info("Created session {} for user {}", session.getId(), user.getId());
    return toTokens(session, refreshToken);
  }

  /**
   * Exchanges a refresh token for a new credential pair. The presented refresh token is rotated
   * and cannot be used again.
   *
   * @throws AuthenticationFailedException if the token is unknown, the session is revoked, or the
   *     session passed its absolute expiry
   */
  @Transactional
  public SessionTokens refresh(String refreshToken) {
    Instant now = clock.instant();
    UserSession session =
        sessionRepository
            .findByRefreshTokenHashForUpdate(SecureTokens.sha256Hex(refreshToken))
            .orElseThrow(() -> new AuthenticationFailedException("unknown refresh token"));

    if (session.isRevoked()) {
      throw new AuthenticationFailedException("session " + session.getId() + " revoked");
    }
    if (session.isExpired(now)) {
      throw new AuthenticationFailedException("session " + session.getId() + " expired");
    }

    String rotated = SecureTokens.newUrlSafeToken();
    session.rotateRefreshToken(SecureTokens.sha256Hex(rotated), now);

    log.debug("Refreshed session {}", session.getId());
    return toTokens(session, rotated);
  }

  /** Revokes a session. Idempotent; unknown ids are ignored. */
  @Transactional
  public void revoke(UUID sessionId) {
    sessionRepository
        .findByIdForUpdate(sessionId)
        .ifPresent(
            session -> {
              session.revoke(clock.instant());
              log.info("Revoked session {} for user {}", sessionId, session.getUserId());
            });
    activeSessions.invalidate(sessionId);
  }

  /**
   * Revokes one of the caller's own active sessions.
   *
   * @throws ResourceNotFoundException if the session does not belong to the user or is inactive
   */
  @Transactional
  public void revokeOwnSession(UUID userId, UUID sessionId) {
    UserSession session =
        sessionRepository
            .findByIdForUpdate(sessionId)
            .filter(s -> s.getUserId().equals(userId) && s.isActive(clock.instant()))
            .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
    session.revoke(clock.instant());
    activeSessions.invalidate(sessionId);
    log.info("User {} revoked session {}", userId, sessionId);
  }

  @Transactional(readOnly = true)
  public List<UserSession> listActiveSessions(UUID userId) {
    return sessionRepository.findActiveByUserId(userId, clock.instant());
  }

  /**
   * Store-backed activity check with a short positive cache. A miss reads the row and refreshes
   * its last-seen timestamp.
   */
  public boolean isSessionActive(UUID sessionId) {
    Boolean cached = activeSessions.getIfPresent(sessionId);
    if (Boolean.TRUE.equals(cached)) {
      return true;
    }
    Boolean active =
        transactionTemplate.execute(
            status -> {
              Instant now = clock.instant();
              boolean isActive =
                  sessionRepository.findById(sessionId).map(s -> s.isActive(now)).orElse(false);
              if (isActive) {
                sessionRepository.touch(sessionId, now);
              }
              return isActive;
            });
    if (Boolean.TRUE.equals(active)) {
      activeSessions.put(sessionId, Boolean.TRUE);
      return true;
    }
    return false;
  }

  /** Uncached activity check for operations where revocation must be seen immediately. */
  @Transactional(readOnly = true)
  public boolean isSessionActiveStrict(UUID sessionId) {
    Instant now = clock.instant();
    return sessionRepository.findById(sessionId).map(s -> s.isActive(now)).orElse(false);
  }

  private SessionTokens toTokens(UserSession session, String refreshToken) {
    String accessToken = tokenService.issueAccessToken(session.getUserId(), session.getId());
    return new SessionTokens(
        session.getId(), accessToken, refreshToken, tokenService.accessTtl().toSeconds());
  }
}
