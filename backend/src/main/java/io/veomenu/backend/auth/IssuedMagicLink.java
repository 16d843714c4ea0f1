package io.veomenu.backend.auth;

import java.time.Instant;

/** A freshly issued magic link; {@code url} embeds the raw token. */
public record IssuedMagicLink(String url, Instant expiresAt) {

  @Override
  public String toString() {
    return "IssuedMagicLink[expiresAt=" + expiresAt + "]";
  }
}
