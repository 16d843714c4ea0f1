package io.veomenu.backend.notification;

import java.util.Objects;

/**
 * A single authentication message addressed to one person. Channels pick the recipient field they
 * deliver to; fields that do not apply to a type are null.
 *
 * @param type what is being sent
 * @param recipientEmail destination for the email channel
 * @param recipientPhone destination for the SMS channel
 * @param recipientName display name used in greetings
 * @param secret one-time code or magic-link URL, never logged
 * @param validMinutes lifetime of {@code secret}, shown to the recipient
 */
public record AuthNotification(
    NotificationType type,
    String recipientEmail,
    String recipientPhone,
    String recipientName,
    String secret,
    long validMinutes) {

  public AuthNotification {
    Objects.requireNonNull(type, "type");
  }

  public static AuthNotification otpCode(String email, String phone, String code, long minutes) {
    return new AuthNotification(NotificationType.OTP_CODE, email, phone, null, code, minutes);
  }

  public static AuthNotification magicLink(String email, String name, String url, long minutes) {
    return new AuthNotification(NotificationType.MAGIC_LINK, email, null, name, url, minutes);
  }

  public static AuthNotification phoneVerification(String phone, String code, long minutes) {
    return new AuthNotification(
        NotificationType.PHONE_VERIFICATION, null, phone, null, code, minutes);
  }

  public static AuthNotification welcome(String email, String name) {
    return new AuthNotification(NotificationType.WELCOME, email, null, name, null, 0);
  }

  @Override
  public String toString() {
    return "AuthNotification[type=" + type + ", email=" + recipientEmail + "]";
  }
}
