package io.veomenu.backend.session;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT s FROM UserSession s WHERE s.refreshTokenHash = :hash")
  Optional<UserSession> findByRefreshTokenHashForUpdate(@Param("hash") String refreshTokenHash);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT s FROM UserSession s WHERE s.id = :id")
  Optional<UserSession> findByIdForUpdate(@Param("id") UUID id);

  @Query(
      """
      SELECT s FROM UserSession s
      WHERE s.userId = :userId AND s.revokedAt IS NULL AND s.expiresAt > :now
      ORDER BY s.lastSeenAt DESC
      """)
  List<UserSession> findActiveByUserId(@Param("userId") UUID userId, @Param("now") Instant now);

  @Modifying
  @Query("UPDATE UserSession s SET s.lastSeenAt = :now WHERE s.id = :id")
  int touch(@Param("id") UUID id, @Param("now") Instant now);

  @Modifying
  @Query("DELETE FROM UserSession s WHERE s.expiresAt < :cutoff")
  int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
