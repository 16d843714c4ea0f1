package io.veomenu.backend.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Random secret generation and hashing for credentials that are handed to clients but only
 * stored as SHA-256 digests (magic links, refresh tokens, one-time codes).
 */
public final class SecureTokens {

  private static final int TOKEN_BYTES = 32;
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private SecureTokens() {}

  /** Returns 32 random bytes encoded as URL-safe Base64 without padding. */
  public static String newUrlSafeToken() {
    byte[] tokenBytes = new byte[TOKEN_BYTES];
    SECURE_RANDOM.nextBytes(tokenBytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(tokenBytes);
  }

  /** Returns a uniformly random numeric code of {@code digits} length, leading zeros kept. */
  public static String newNumericCode(int digits) {
    int bound = (int) Math.pow(10, digits);
    return String.format(Locale.ROOT, "%0" + digits + "d", SECURE_RANDOM.nextInt(bound));
  }

  /** Hashes a raw secret using SHA-256, returning the hex-encoded hash. */
  public static String sha256Hex(String raw) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hashBytes = digest.digest(raw.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hashBytes);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /** Compares two hex hashes in time independent of where they first differ. */
  public static boolean hashesMatch(String expectedHash, String actualHash) {
    if (expectedHash == null || actualHash == null) {
      return false;
    }
    return MessageDigest.isEqual(
        expectedHash.getBytes(StandardCharsets.US_ASCII),
        actualHash.getBytes(StandardCharsets.US_ASCII));
  }
}
