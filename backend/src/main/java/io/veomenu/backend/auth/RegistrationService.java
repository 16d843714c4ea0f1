package io.veomenu.backend.auth;

import io.veomenu.backend.config.AuthProperties;
import io.veomenu.backend.notification.AuthNotification;
import io.veomenu.backend.notification.DispatchResult;
import io.veomenu.backend.notification.NotificationDispatcher;
import io.veomenu.backend.notification.channel.EmailNotificationChannel;
import io.veomenu.backend.notification.channel.SmsNotificationChannel;
import io.veomenu.backend.session.DeviceMetadata;
import io.veomenu.backend.session.SessionService;
import io.veomenu.backend.user.User;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Orchestrates dual-channel registration: issue a code, send it by email and SMS, verify it and
 * log the new user in. Each step commits on its own so deliveries happen after the challenge is
 * stored and a slow transport never holds a row lock.
 */
@Service
public class RegistrationService {

  private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);
  private static final List<String> CODE_CHANNELS =
      List.of(EmailNotificationChannel.CHANNEL_ID, SmsNotificationChannel.CHANNEL_ID);

  private final OtpChallengeService challengeService;
  private final SessionService sessionService;
  private final NotificationDispatcher dispatcher;
  private final long codeValidMinutes;

  public RegistrationService(
      OtpChallengeService challengeService,
      SessionService sessionService,
      NotificationDispatcher dispatcher,
      AuthProperties properties) {
    this.challengeService = challengeService;
    this.sessionService = sessionService;
    this.dispatcher = dispatcher;
    this.codeValidMinutes = properties.otp().ttl().toMinutes();
  }

  /** Starts (or restarts) a registration and sends the code over both channels. */
  public CodeDelivery register(PendingRegistration registration, String ip) {
    IssuedCode issued;
    try {
      issued = challengeService.issue(registration, ip);
    } catch (DataIntegrityViolationException e) {
      // A concurrent first issue for the same pair won the insert; the retry updates its row.
      log.debug("Concurrent registration for {}, retrying as re-issue", registration.email());
      issued = challengeService.issue(registration, ip);
    }
    return deliver(issued);
  }

  /** Sends a fresh code for an existing pending registration; the old code stops working. */
  public CodeDelivery resend(String email, String phone, String ip) {
    return deliver(
        challengeService.resend(
            PendingRegistration.normalizeEmail(email), PhoneNumbers.normalize(phone), ip));
  }

  /**
   * Verifies the code, creating the account and a first session.
   *
   * @throws DuplicateRegistrationException if the email got registered in the meantime
   */
  public VerifiedLogin verify(String email, String phone, String code, DeviceMetadata device) {
    User user;
    try {
      user =
          challengeService.verify(
              PendingRegistration.normalizeEmail(email), PhoneNumbers.normalize(phone), code);
    } catch (DataIntegrityViolationException e) {
      log.warn("Registration verify lost a race on email uniqueness");
      throw new DuplicateRegistrationException();
    }

    var tokens = sessionService.createSession(user, device);
    dispatcher.dispatchAsync(
        AuthNotification.welcome(user.getEmail(), user.getName()),
        List.of(EmailNotificationChannel.CHANNEL_ID));
    return new VerifiedLogin(user, tokens);
  }

  private CodeDelivery deliver(IssuedCode issued) {
    var registration = issued.registration();
    var notification =
        AuthNotification.otpCode(
            registration.email(), registration.phone(), issued.code(), codeValidMinutes);
    DispatchResult result = dispatcher.dispatch(notification, CODE_CHANNELS);
    if (!result.anySucceeded()) {
      log.warn("Registration code for {} was not delivered on any channel", registration.email());
    }
    return new CodeDelivery(issued.expiresAt(), codeValidMinutes, result);
  }

  /**
   * @param expiresAt when the sent code stops being accepted
   * @param validMinutes lifetime of the code as communicated to the user
   * @param dispatch per-channel delivery outcome
   */
  public record CodeDelivery(Instant expiresAt, long validMinutes, DispatchResult dispatch) {}
}
