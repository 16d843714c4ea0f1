package io.veomenu.backend.auth;

import java.time.Instant;

/**
 * Whether the user may request another phone code right now.
 *
 * @param cooldownActive true while the last code is younger than the cooldown
 * @param cooldownRemainingSeconds whole seconds until a new code may be requested
 * @param canSend the negation of {@code cooldownActive}
 * @param lastSentAt when the last code was issued, or null if none was
 * @param hasActiveCode whether the last code can still be confirmed
 */
public record PhoneVerificationStatus(
    boolean cooldownActive,
    long cooldownRemainingSeconds,
    boolean canSend,
    Instant lastSentAt,
    boolean hasActiveCode) {

  public static PhoneVerificationStatus none() {
    return new PhoneVerificationStatus(false, 0, true, null, false);
  }
}
