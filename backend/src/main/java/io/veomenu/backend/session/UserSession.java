package io.veomenu.backend.session;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Server-side record of a login. Holds the SHA-256 hash of the current refresh token; the raw
 * refresh token and the access token are never stored. A session is usable while it is neither
 * revoked nor past its absolute expiry.
 */
@Entity
@Table(name = "user_sessions")
public class UserSession {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "refresh_token_hash", nullable = false, length = 64)
  private String refreshTokenHash;

  @Column(name = "user_agent", length = 512)
  private String userAgent;

  @Column(name = "device_type", length = 20)
  private String deviceType;

  @Column(name = "ip_address", length = 45)
  private String ipAddress;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "last_seen_at", nullable = false)
  private Instant lastSeenAt;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "revoked_at")
  private Instant revokedAt;

  protected UserSession() {}

  public UserSession(
      UUID userId,
      String refreshTokenHash,
      DeviceMetadata device,
      Instant createdAt,
      Instant expiresAt) {
    this.userId = userId;
    this.refreshTokenHash = refreshTokenHash;
    this.userAgent = device.userAgent();
    this.deviceType = device.deviceType();
    this.ipAddress = device.ipAddress();
    this.createdAt = createdAt;
    this.lastSeenAt = createdAt;
    this.expiresAt = expiresAt;
  }

  /** Replaces the refresh token hash; the previous refresh token stops working. */
  public void rotateRefreshToken(String newRefreshTokenHash, Instant now) {
    this.refreshTokenHash = newRefreshTokenHash;
    this.lastSeenAt = now;
  }

  public void revoke(Instant now) {
    if (revokedAt == null) {
      this.revokedAt = now;
    }
  }

  public boolean isRevoked() {
    return revokedAt != null;
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }

  public boolean isActive(Instant now) {
    return !isRevoked() && !isExpired(now);
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getRefreshTokenHash() {
    return refreshTokenHash;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public String getDeviceType() {
    return deviceType;
  }

  public String getIpAddress() {
    return ipAddress;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getLastSeenAt() {
    return lastSeenAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getRevokedAt() {
    return revokedAt;
  }
}
