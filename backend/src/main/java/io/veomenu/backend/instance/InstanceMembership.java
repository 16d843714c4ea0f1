package io.veomenu.backend.instance;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Grants a user a role within one instance. Unique per (user, instance). */
@Entity
@Table(name = "instance_memberships")
public class InstanceMembership {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "instance_id", nullable = false, updatable = false)
  private UUID instanceId;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 20)
  private MembershipRole role;

  @Column(name = "joined_at", nullable = false, updatable = false)
  private Instant joinedAt;

  protected InstanceMembership() {}

  public InstanceMembership(
      UUID userId, UUID instanceId, MembershipRole role, Instant joinedAt) {
    this.userId = userId;
    this.instanceId = instanceId;
    this.role = role;
    this.joinedAt = joinedAt;
  }

  public void changeRole(MembershipRole role) {
    this.role = role;
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public UUID getInstanceId() {
    return instanceId;
  }

  public MembershipRole getRole() {
    return role;
  }

  public Instant getJoinedAt() {
    return joinedAt;
  }
}
