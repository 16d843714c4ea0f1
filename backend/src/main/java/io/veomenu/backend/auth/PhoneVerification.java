package io.veomenu.backend.auth;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * The single phone-ownership challenge of a signed-in user. Requesting a new code rewrites the row
 * for the new number; the code is stored as its SHA-256 hash.
 */
@Entity
@Table(name = "phone_verifications")
public class PhoneVerification {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "phone", nullable = false, length = 20)
  private String phone;

  @Column(name = "code_hash", nullable = false, length = 64)
  private String codeHash;

  @Column(name = "issued_at", nullable = false)
  private Instant issuedAt;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "verified_at")
  private Instant verifiedAt;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "max_attempts", nullable = false)
  private int maxAttempts;

  protected PhoneVerification() {}

  public PhoneVerification(
      UUID userId,
      String phone,
      String codeHash,
      Instant issuedAt,
      Instant expiresAt,
      int maxAttempts) {
    this.userId = userId;
    this.phone = phone;
    this.codeHash = codeHash;
    this.issuedAt = issuedAt;
    this.expiresAt = expiresAt;
    this.maxAttempts = maxAttempts;
  }

  /** Replaces the number and code; the attempt budget and cooldown start over. */
  public void reissue(
      String phone, String codeHash, Instant issuedAt, Instant expiresAt, int maxAttempts) {
    this.phone = phone;
    this.codeHash = codeHash;
    this.issuedAt = issuedAt;
    this.expiresAt = expiresAt;
    this.maxAttempts = maxAttempts;
    this.attempts = 0;
    this.verifiedAt = null;
  }

  /** Time left before another code may be requested; zero once the cooldown has passed. */
  public Duration cooldownRemaining(Instant now, Duration cooldown) {
    Duration remaining = Duration.between(now, issuedAt.plus(cooldown));
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  /** A code that can still be confirmed: not verified, not exhausted, not expired. */
  public boolean isPending(Instant now) {
    return !isVerified() && !isExhausted() && !isExpired(now);
  }

  public boolean isVerified() {
    return verifiedAt != null;
  }

  public boolean isExhausted() {
    return attempts >= maxAttempts;
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }

  public void recordFailedAttempt() {
    this.attempts++;
  }

  public int remainingAttempts() {
    return Math.max(0, maxAttempts - attempts);
  }

  public void markVerified(Instant now) {
    this.verifiedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getPhone() {
    return phone;
  }

  public String getCodeHash() {
    return codeHash;
  }

  public Instant getIssuedAt() {
    return issuedAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getVerifiedAt() {
    return verifiedAt;
  }

  public int getAttempts() {
    return attempts;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }
}
