package io.veomenu.backend.auth;

import io.veomenu.backend.config.AuthProperties;
import io.veomenu.backend.notification.AuthNotification;
import io.veomenu.backend.notification.NotificationDispatcher;
import io.veomenu.backend.notification.channel.EmailNotificationChannel;
import io.veomenu.backend.session.AuthenticatedUser;
import io.veomenu.backend.session.AuthenticationFailedException;
import io.veomenu.backend.session.DeviceMetadata;
import io.veomenu.backend.session.SessionService;
import io.veomenu.backend.session.SessionTokens;
import io.veomenu.backend.user.User;
import io.veomenu.backend.user.UserRepository;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Login by magic link, plus the session lifecycle endpoints that follow a login. */
@Service
public class PasswordlessLoginService {

  private static final Logger log = LoggerFactory.getLogger(PasswordlessLoginService.class);

  private final UserRepository userRepository;
  private final MagicLinkService magicLinkService;
  private final SessionService sessionService;
  private final NotificationDispatcher dispatcher;
  private final long linkValidMinutes;

  public PasswordlessLoginService(
      UserRepository userRepository,
      MagicLinkService magicLinkService,
      SessionService sessionService,
      NotificationDispatcher dispatcher,
      AuthProperties properties) {
    this.userRepository = userRepository;
    this.magicLinkService = magicLinkService;
    this.sessionService = sessionService;
    this.dispatcher = dispatcher;
    this.linkValidMinutes = properties.magicLink().ttl().toMinutes();
  }

  /**
   * Issues and emails a magic link when the email belongs to an active account. Unknown emails,
   * inactive accounts and rate-limited requests yield an empty result so callers can answer
   * identically in every case. The email is queued; this call never waits on the mail transport.
   *
   * @return the issued link, for echoing in non-production profiles only
   */
  public Optional<IssuedMagicLink> requestMagicLink(String email, String ip) {
    User user =
        userRepository.findByEmail(PendingRegistration.normalizeEmail(email)).orElse(null);
    if (user == null || !user.isActive()) {
      log.info("Magic link requested for unknown or inactive account");
      return Optional.empty();
    }

    IssuedMagicLink link;
    try {
      link = magicLinkService.issue(user, ip);
    } catch (MagicLinkRateLimitedException e) {
      log.warn(e.getMessage());
      return Optional.empty();
    }

    var notification =
        AuthNotification.magicLink(user.getEmail(), user.getName(), link.url(), linkValidMinutes);
    dispatcher.dispatchAsync(notification, List.of(EmailNotificationChannel.CHANNEL_ID));
    log.debug("Queued magic link email for user {}", user.getId());
    return Optional.of(link);
  }

  /** Consumes a magic link and opens a session for its owner. */
  public VerifiedLogin verifyMagicLink(String token, DeviceMetadata device) {
    User user = magicLinkService.verifyAndConsume(token);
    SessionTokens tokens = sessionService.createSession(user, device);
    return new VerifiedLogin(user, tokens);
  }

  public SessionTokens refresh(String refreshToken) {
    return sessionService.refresh(refreshToken);
  }

  /**
   * Revokes the caller's current session. The revocation state is read from the store, not the
   * activity cache.
   */
  public void logout(AuthenticatedUser caller) {
    if (!sessionService.isSessionActiveStrict(caller.sessionId())) {
      throw new AuthenticationFailedException("logout on inactive session " + caller.sessionId());
    }
    sessionService.revoke(caller.sessionId());
  }
}
