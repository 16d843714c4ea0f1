package io.veomenu.backend.auth;

import java.util.Locale;

/**
 * Registration data held on an OTP challenge until the code is verified.
 *
 * @param email lower-cased email, the identity key
 * @param phone normalized phone number
 * @param name display name
 * @param language preferred locale, defaults to {@code en}
 */
public record PendingRegistration(String email, String phone, String name, String language) {

  public static PendingRegistration of(String email, String phone, String name, String language) {
    return new PendingRegistration(
        normalizeEmail(email),
        PhoneNumbers.normalize(phone),
        name.trim(),
        language == null || language.isBlank() ? "en" : language.trim());
  }

  public static String normalizeEmail(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }
}
