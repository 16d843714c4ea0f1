package io.veomenu.backend.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.veomenu.backend.config.AuthProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class SessionTokenServiceTest {

  private static final String SECRET = "unit-test-secret-that-is-long-enough-0123456789";
  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  private static AuthProperties properties(String secret) {
    return new AuthProperties(
        new AuthProperties.MagicLink(Duration.ofMinutes(15), 3, Duration.ofMinutes(5), false),
        new AuthProperties.Otp(Duration.ofMinutes(10), 3),
        new AuthProperties.Session(
            Duration.ofMinutes(60), Duration.ofDays(7), Duration.ofSeconds(30), secret),
        new AuthProperties.PhoneVerification(Duration.ofMinutes(10), 3, Duration.ofMinutes(10)));
  }

  private static SessionTokenService serviceAt(Instant now, String secret) {
    return new SessionTokenService(properties(secret), Clock.fixed(now, ZoneOffset.UTC));
  }

  @Test
  void issuedTokenVerifiesToItsClaims() {
    var service = serviceAt(T0, SECRET);
    UUID userId = UUID.randomUUID();
    UUID sessionId = UUID.randomUUID();

    var claims = service.verifyAccessToken(service.issueAccessToken(userId, sessionId));

    assertThat(claims.userId()).isEqualTo(userId);
    assertThat(claims.sessionId()).isEqualTo(sessionId);
    assertThat(claims.expiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(60)));
  }

  @Test
  void tokenIsRejectedOnceExpired() {
    String token = serviceAt(T0, SECRET).issueAccessToken(UUID.randomUUID(), UUID.randomUUID());
    var later = serviceAt(T0.plus(Duration.ofMinutes(61)), SECRET);

    assertThatThrownBy(() -> later.verifyAccessToken(token))
        .isInstanceOf(AuthenticationFailedException.class)
        .extracting(e -> ((AuthenticationFailedException) e).getReason())
        .isEqualTo("access token expired");
  }

  @Test
  void tamperedPayloadIsRejected() {
    var service = serviceAt(T0, SECRET);
    String token = service.issueAccessToken(UUID.randomUUID(), UUID.randomUUID());
    String[] parts = token.split("\\.");
    String forged =
        parts[0] + "." + parts[1].substring(0, parts[1].length() - 2) + "xx." + parts[2];

    assertThatThrownBy(() -> service.verifyAccessToken(forged))
        .isInstanceOf(AuthenticationFailedException.class);
  }

  @Test
  void tokenSignedWithAnotherSecretIsRejected() {
    String token =
        serviceAt(T0, "another-secret-that-is-also-long-enough-9876543210")
            .issueAccessToken(UUID.randomUUID(), UUID.randomUUID());

    assertThatThrownBy(() -> serviceAt(T0, SECRET).verifyAccessToken(token))
        .isInstanceOf(AuthenticationFailedException.class);
  }

  @Test
  void garbageIsRejectedAsMalformed() {
    assertThatThrownBy(() -> serviceAt(T0, SECRET).verifyAccessToken("not.a.jwt"))
        .isInstanceOf(AuthenticationFailedException.class);
  }

  @Test
  void shortSecretFailsAtStartup() {
    assertThatThrownBy(() -> serviceAt(T0, "too-short"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("at least 32 bytes");
  }
}
