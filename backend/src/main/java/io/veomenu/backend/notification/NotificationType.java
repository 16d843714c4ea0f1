package io.veomenu.backend.notification;

/** Kinds of authentication messages the service sends. */
public enum NotificationType {
  OTP_CODE,
  MAGIC_LINK,
  WELCOME,
  PHONE_VERIFICATION
}
