package io.veomenu.backend.auth;

import io.veomenu.backend.exception.InvalidRequestException;
import java.util.regex.Pattern;

/** Normalizes user-entered phone numbers to {@code +} followed by digits. */
public final class PhoneNumbers {

  private static final Pattern NON_DIALABLE = Pattern.compile("[^\\d+]");
  private static final Pattern E164 = Pattern.compile("\\+[1-9]\\d{7,14}");

  private PhoneNumbers() {}

  /**
   * Strips formatting characters and adds the leading {@code +} when missing. A {@code 00}
   * international prefix is rewritten to {@code +}.
   *
   * @throws InvalidRequestException if the result is not a plausible international number
   */
  public static String normalize(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidRequestException("Invalid phone number", "phone is required");
    }
    String cleaned = NON_DIALABLE.matcher(raw).replaceAll("");
    if (cleaned.startsWith("00")) {
      cleaned = "+" + cleaned.substring(2);
    } else if (!cleaned.startsWith("+")) {
      cleaned = "+" + cleaned;
    }
    if (!E164.matcher(cleaned).matches()) {
      throw new InvalidRequestException(
          "Invalid phone number", "phone must be an international number, e.g. +351912345678");
    }
    return cleaned;
  }
}
