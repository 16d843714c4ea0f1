package io.veomenu.backend.auth;

import java.time.Instant;

/** A freshly issued one-time code, returned to the caller for dispatch only. */
public record IssuedCode(PendingRegistration registration, String code, Instant expiresAt) {

  @Override
  public String toString() {
    return "IssuedCode[email=" + registration.email() + ", expiresAt=" + expiresAt + "]";
  }
}
