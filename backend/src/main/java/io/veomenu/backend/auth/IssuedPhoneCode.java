package io.veomenu.backend.auth;

import java.time.Instant;
import java.util.UUID;

/** A freshly issued phone verification code, returned to the caller for dispatch only. */
public record IssuedPhoneCode(UUID verificationId, String phone, String code, Instant expiresAt) {

  @Override
  public String toString() {
    return "IssuedPhoneCode[verificationId=" + verificationId + ", expiresAt=" + expiresAt + "]";
  }
}
