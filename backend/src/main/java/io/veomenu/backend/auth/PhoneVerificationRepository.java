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

public interface PhoneVerificationRepository extends JpaRepository<PhoneVerification, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT v FROM PhoneVerification v WHERE v.userId = :userId")
  Optional<PhoneVerification> findByUserIdForUpdate(@Param("userId") UUID userId);

  Optional<PhoneVerification> findByUserId(UUID userId);

  @Modifying
  @Query("DELETE FROM PhoneVerification v WHERE v.expiresAt < :cutoff")
  int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
