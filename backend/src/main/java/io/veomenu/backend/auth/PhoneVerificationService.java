package io.veomenu.backend.auth;

import io.veomenu.backend.config.AuthProperties;
import io.veomenu.backend.notification.AuthNotification;
import io.veomenu.backend.notification.DispatchResult;
import io.veomenu.backend.notification.NotificationDispatcher;
import io.veomenu.backend.notification.channel.SmsNotificationChannel;
import io.veomenu.backend.user.User;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Lets a signed-in user attach a phone number: issue a code, text it, confirm it. The code is
 * stored before the text is sent, and the text is sent outside any transaction.
 */
@Service
public class PhoneVerificationService {

  private static final Logger log = LoggerFactory.getLogger(PhoneVerificationService.class);

  private final PhoneChallengeService challengeService;
  private final NotificationDispatcher dispatcher;
  private final long codeValidMinutes;

  public PhoneVerificationService(
      PhoneChallengeService challengeService,
      NotificationDispatcher dispatcher,
      AuthProperties properties) {
    this.challengeService = challengeService;
    this.dispatcher = dispatcher;
    this.codeValidMinutes = properties.phoneVerification().ttl().toMinutes();
  }

  /** Normalizes {@code phone}, issues a code for it and texts the code. */
  public PhoneCodeDelivery request(UUID userId, String phone) {
    IssuedPhoneCode issued = challengeService.issue(userId, PhoneNumbers.normalize(phone));

    var notification =
        AuthNotification.phoneVerification(issued.phone(), issued.code(), codeValidMinutes);
    DispatchResult result =
        dispatcher.dispatch(notification, List.of(SmsNotificationChannel.CHANNEL_ID));
    if (!result.allSucceeded()) {
      log.warn("Phone code {} for user {} was not delivered", issued.verificationId(), userId);
    }
    return new PhoneCodeDelivery(
        issued.verificationId(),
        issued.phone(),
        issued.expiresAt(),
        codeValidMinutes,
        result.allSucceeded());
  }

  public User confirm(UUID userId, String code) {
    return challengeService.verify(userId, code);
  }

  public PhoneVerificationStatus cooldown(UUID userId) {
    return challengeService.status(userId);
  }

  /**
   * @param verificationId the user's phone challenge
   * @param phone the normalized number the code was texted to
   * @param expiresAt when the code stops being accepted
   * @param validMinutes lifetime of the code as communicated to the user
   * @param delivered whether the SMS provider accepted the text
   */
  public record PhoneCodeDelivery(
      UUID verificationId, String phone, Instant expiresAt, long validMinutes, boolean delivered) {}
}
