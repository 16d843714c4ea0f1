package io.veomenu.backend.auth;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MagicLinkRepository extends JpaRepository<MagicLink, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT m FROM MagicLink m WHERE m.tokenHash = :tokenHash")
  Optional<MagicLink> findByTokenHashForUpdate(@Param("tokenHash") String tokenHash);

  long countByUserIdAndIssuedAtAfter(UUID userId, Instant since);

  /** Consumes every outstanding link of the user. */
  @Modifying
  @Query(
      """
      UPDATE MagicLink m SET m.consumedAt = :now
      WHERE m.userId = :userId AND m.consumedAt IS NULL
      """)
  int consumeOutstanding(@Param("userId") UUID userId, @Param("now") Instant now);

  @Modifying
  @Query("DELETE FROM MagicLink m WHERE m.expiresAt < :cutoff")
  int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
