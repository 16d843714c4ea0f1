package io.veomenu.backend.auth;

import java.util.UUID;

/**
 * A user asked for more links than the issuance window allows. Kept internal: the HTTP response
 * for link requests is the same whether or not a link was issued.
 */
public class MagicLinkRateLimitedException extends RuntimeException {

  public MagicLinkRateLimitedException(UUID userId) {
    super("Magic link rate limit exceeded for user " + userId);
  }
}
