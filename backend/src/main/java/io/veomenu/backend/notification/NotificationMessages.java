package io.veomenu.backend.notification;

/** Plain-text subjects and bodies for authentication messages. */
public final class NotificationMessages {

  private NotificationMessages() {}

  public static String emailSubject(AuthNotification notification) {
    return switch (notification.type()) {
      case OTP_CODE -> "Your VEOmenu Verification Code";
      case MAGIC_LINK -> "Your VEOmenu Login Link";
      case WELCOME -> "Welcome to VEOmenu!";
      case PHONE_VERIFICATION -> throw noText("email", notification);
    };
  }

  public static String emailBody(AuthNotification notification) {
    return switch (notification.type()) {
      case OTP_CODE ->
          "Your VEOmenu verification code is: "
              + notification.secret()
              + "\n\nThis code expires in "
              + notification.validMinutes()
              + " minutes.\n\nIf you didn't request this verification, please ignore this email.";
      case MAGIC_LINK ->
          "Click here to log in: "
              + notification.secret()
              + "\n\nThis link expires in "
              + notification.validMinutes()
              + " minutes.";
      case WELCOME ->
          "Welcome, "
              + (notification.recipientName() != null ? notification.recipientName() : "there")
              + "!\n\nYour VEOmenu account has been created and verified. You can now start"
              + " building menus for your customers.";
      case PHONE_VERIFICATION -> throw noText("email", notification);
    };
  }

  public static String smsBody(AuthNotification notification) {
    return switch (notification.type()) {
      case OTP_CODE ->
          "Your VEOmenu verification code is: "
              + notification.secret()
              + "\n\nThis code expires in "
              + notification.validMinutes()
              + " minutes.";
      case PHONE_VERIFICATION ->
          "Your VEOmenu verification code is: "
              + notification.secret()
              + ". This code expires in "
              + notification.validMinutes()
              + " minutes.";
      case MAGIC_LINK, WELCOME -> throw noText("SMS", notification);
    };
  }

  private static IllegalArgumentException noText(String channel, AuthNotification notification) {
    return new IllegalArgumentException("No " + channel + " text for " + notification.type());
  }
}
