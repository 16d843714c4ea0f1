package io.veomenu.backend.auth;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * One pending registration, keyed by (email, phone). Holds the SHA-256 hash of the current
 * one-time code and the attempt budget; re-issuing replaces the code and resets the budget. The
 * row becomes terminal once verified or once attempts reach the bound.
 */
@Entity
@Table(name = "otp_challenges")
public class OtpChallenge {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "email", nullable = false, updatable = false, length = 255)
  private String email;

  @Column(name = "phone", nullable = false, updatable = false, length = 20)
  private String phone;

  @Column(name = "code_hash", nullable = false, length = 64)
  private String codeHash;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "language", nullable = false, length = 10)
  private String language;

  @Column(name = "issued_at", nullable = false)
  private Instant issuedAt;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "verified", nullable = false)
  private boolean verified;

  @Column(name = "verified_at")
  private Instant verifiedAt;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "max_attempts", nullable = false)
  private int maxAttempts;

  @Column(name = "created_ip", length = 45)
  private String createdIp;

  protected OtpChallenge() {}

  public OtpChallenge(
      PendingRegistration registration,
      String codeHash,
      Instant issuedAt,
      Instant expiresAt,
      int maxAttempts,
      String createdIp) {
    this.email = registration.email();
    this.phone = registration.phone();
    this.name = registration.name();
    this.language = registration.language();
    this.codeHash = codeHash;
    this.issuedAt = issuedAt;
    this.expiresAt = expiresAt;
    this.maxAttempts = maxAttempts;
    this.createdIp = createdIp;
  }

  /** Supersedes the current code: new hash, fresh expiry, attempts reset. */
  public void reissue(
      String newCodeHash, Instant issuedAt, Instant expiresAt, int maxAttempts, String ip) {
    this.codeHash = newCodeHash;
    this.issuedAt = issuedAt;
    this.expiresAt = expiresAt;
    this.maxAttempts = maxAttempts;
    this.attempts = 0;
    this.verified = false;
    this.verifiedAt = null;
    this.createdIp = ip;
  }

  public void updateRegistration(String name, String language) {
    this.name = name;
    this.language = language;
  }

  public boolean isExhausted() {
    return attempts >= maxAttempts;
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }

  /** Spends one attempt. */
  public void recordFailedAttempt() {
    this.attempts++;
  }

  public int remainingAttempts() {
    return Math.max(0, maxAttempts - attempts);
  }

  public void markVerified(Instant now) {
    this.verified = true;
    this.verifiedAt = now;
  }

  public PendingRegistration toRegistration() {
    return new PendingRegistration(email, phone, name, language);
  }

  public UUID getId() {
    return id;
  }

  public String getEmail() {
    return email;
  }

  public String getPhone() {
    return phone;
  }

  public String getCodeHash() {
    return codeHash;
  }

  public String getName() {
    return name;
  }

  public String getLanguage() {
    return language;
  }

  public Instant getIssuedAt() {
    return issuedAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public boolean isVerified() {
    return verified;
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

  public String getCreatedIp() {
    return createdIp;
  }
}
