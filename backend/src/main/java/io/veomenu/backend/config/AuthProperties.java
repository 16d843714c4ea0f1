package io.veomenu.backend.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Tunables for passwordless authentication. All values are externally supplied (environment or
 * {@code application.yml}); the defaults mirror the production policy.
 *
 * @param magicLink magic-link issuance policy
 * @param otp registration one-time code policy
 * @param session session credential policy
 * @param phoneVerification policy for confirming a signed-in user's phone number
 */
@ConfigurationProperties(prefix = "veomenu.auth")
public record AuthProperties(
    @DefaultValue MagicLink magicLink,
    @DefaultValue Otp otp,
    @DefaultValue Session session,
    @DefaultValue PhoneVerification phoneVerification) {

  /**
   * @param ttl lifetime of an issued link
   * @param maxPerWindow links a single user may request within {@code rateLimitWindow}
   * @param rateLimitWindow sliding window for the issuance rate limit
   * @param supersedePrevious when true, issuing a link consumes the user's outstanding links
   */
  public record MagicLink(
      @DefaultValue("15m") Duration ttl,
      @DefaultValue("3") int maxPerWindow,
      @DefaultValue("5m") Duration rateLimitWindow,
      @DefaultValue("false") boolean supersedePrevious) {}

  /**
   * @param ttl lifetime of an issued code
   * @param maxAttempts incorrect guesses after which the challenge is exhausted
   */
  public record Otp(@DefaultValue("10m") Duration ttl, @DefaultValue("3") int maxAttempts) {}

  /**
   * @param accessTtl lifetime of the signed access token
   * @param refreshTtl absolute lifetime of the session and its refresh token
   * @param activityCacheTtl how long a positive "session still active" lookup is trusted
   * @param jwtSecret HMAC key for access tokens, at least 32 bytes
   */
  public record Session(
      @DefaultValue("60m") Duration accessTtl,
      @DefaultValue("7d") Duration refreshTtl,
      @DefaultValue("30s") Duration activityCacheTtl,
      String jwtSecret) {}

  /**
   * @param ttl lifetime of a texted code
   * @param maxAttempts incorrect guesses after which the code is exhausted
   * @param cooldown minimum time between two codes for the same user, measured from issuance
   */
  public record PhoneVerification(
      @DefaultValue("10m") Duration ttl,
      @DefaultValue("3") int maxAttempts,
      @DefaultValue("10m") Duration cooldown) {}
}
