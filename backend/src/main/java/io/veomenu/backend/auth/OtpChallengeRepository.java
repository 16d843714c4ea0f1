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

public interface OtpChallengeRepository extends JpaRepository<OtpChallenge, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT c FROM OtpChallenge c WHERE c.email = :email AND c.phone = :phone")
  Optional<OtpChallenge> findByEmailAndPhoneForUpdate(
      @Param("email") String email, @Param("phone") String phone);

  Optional<OtpChallenge> findByEmailAndPhone(String email, String phone);

  @Modifying
  @Query("DELETE FROM OtpChallenge c WHERE c.expiresAt < :cutoff")
  int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
