package io.veomenu.backend.session;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.veomenu.backend.config.AuthProperties;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies short-lived HS256 access tokens. Verification needs no store lookup: the
 * token carries the user id, the session id and its expiry. Revocation is checked separately by
 * {@link SessionService}.
 */
@Service
public class SessionTokenService {

  private static final Logger log = LoggerFactory.getLogger(SessionTokenService.class);
  private static final String TOKEN_TYPE = "access";
  private static final int MIN_SECRET_BYTES = 32;

  private final byte[] secret;
  private final Duration accessTtl;
  private final Clock clock;

  public SessionTokenService(AuthProperties properties, Clock clock) {
    String configured = properties.session().jwtSecret();
    if (configured == null
        || configured.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      throw new IllegalStateException(
          "veomenu.auth.session.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    this.secret = configured.getBytes(StandardCharsets.UTF_8);
    this.accessTtl = properties.session().accessTtl();
    this.clock = clock;
  }

  /** Claims extracted from a verified access token. */
  public record AccessClaims(UUID userId, UUID sessionId, Instant expiresAt) {}

  public Duration accessTtl() {
    return accessTtl;
  }

  /**
   * Issues an access token for the given session.
   *
   * @return signed JWT string
   */
  public String issueAccessToken(UUID userId, UUID sessionId) {
    try {
      Instant now = clock.instant();
      var claims =
          new JWTClaimsSet.Builder()
              .jwtID(UUID.randomUUID().toString())
              .subject(userId.toString())
              .claim("sid", sessionId.toString())
              .claim("type", TOKEN_TYPE)
              .issueTime(Date.from(now))
              .expirationTime(Date.from(now.plus(accessTtl)))
              .build();

      var signedJwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
      JWSSigner signer = new MACSigner(secret);
      signedJwt.sign(signer);

      log.debug("Issued access token for user {} session {}", userId, sessionId);
      return signedJwt.serialize();
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign access token", e);
    }
  }

  /**
   * Verifies an access token: validates signature, checks type and expiry, extracts claims.
   *
   * @throws AuthenticationFailedException if the token is invalid or expired
   */
  public AccessClaims verifyAccessToken(String token) {
    try {
      var signedJwt = SignedJWT.parse(token);
      JWSVerifier verifier = new MACVerifier(secret);

      if (!JWSAlgorithm.HS256.equals(signedJwt.getHeader().getAlgorithm())
          || !signedJwt.verify(verifier)) {
        throw new AuthenticationFailedException("bad signature");
      }

      var claims = signedJwt.getJWTClaimsSet();

      Date expiration = claims.getExpirationTime();
      if (expiration == null || !expiration.toInstant().isAfter(clock.instant())) {
        throw new AuthenticationFailedException("access token expired");
      }

      if (!TOKEN_TYPE.equals(claims.getStringClaim("type"))) {
        throw new AuthenticationFailedException("wrong token type");
      }

      String subject = claims.getSubject();
      String sessionId = claims.getStringClaim("sid");
      if (subject == null || sessionId == null) {
        throw new AuthenticationFailedException("missing subject or session claim");
      }

      return new AccessClaims(
          UUID.fromString(subject), UUID.fromString(sessionId), expiration.toInstant());
    } catch (ParseException | JOSEException | IllegalArgumentException e) {
      throw new AuthenticationFailedException("malformed access token: " + e.getMessage());
    }
  }
}
