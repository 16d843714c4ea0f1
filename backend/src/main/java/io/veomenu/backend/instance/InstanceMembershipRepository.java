package io.veomenu.backend.instance;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InstanceMembershipRepository extends JpaRepository<InstanceMembership, UUID> {

  Optional<InstanceMembership> findByUserIdAndInstanceId(UUID userId, UUID instanceId);

  boolean existsByUserIdAndInstanceId(UUID userId, UUID instanceId);

  @Query(
      """
      SELECT new io.veomenu.backend.instance.MembershipSummary(
          i.id, i.name, i.slug, i.status, m.role)
      FROM InstanceMembership m JOIN Instance i ON i.id = m.instanceId
      WHERE m.userId = :userId
      ORDER BY m.joinedAt
      """)
  List<MembershipSummary> findSummariesByUserId(@Param("userId") UUID userId);

  @Query(
      """
      SELECT new io.veomenu.backend.instance.MembershipSummary(
          i.id, i.name, i.slug, i.status, m.role)
      FROM InstanceMembership m JOIN Instance i ON i.id = m.instanceId
      WHERE m.userId = :userId AND m.instanceId = :instanceId
      """)
  Optional<MembershipSummary> findSummary(
      @Param("userId") UUID userId, @Param("instanceId") UUID instanceId);

  @Query(
      """
      SELECT new io.veomenu.backend.instance.MemberView(
          u.id, u.email, u.name, m.role, m.joinedAt)
      FROM InstanceMembership m JOIN User u ON u.id = m.userId
      WHERE m.instanceId = :instanceId
      ORDER BY m.joinedAt
      """)
  List<MemberView> findMembers(@Param("instanceId") UUID instanceId);
}
