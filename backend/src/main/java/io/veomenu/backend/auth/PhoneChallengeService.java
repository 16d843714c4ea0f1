package io.veomenu.backend.auth;

import io.veomenu.backend.config.AuthProperties;
import io.veomenu.backend.exception.ResourceConflictException;
import io.veomenu.backend.exception.ResourceNotFoundException;
import io.veomenu.backend.security.SecureTokens;
import io.veomenu.backend.user.User;
import io.veomenu.backend.user.UserRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and verifies the codes that prove a signed-in user receives texts on a phone number. Each
 * user has at most one {@link PhoneVerification}. Issuing and verifying both lock the user row
 * before the challenge row, so concurrent requests for one user are serialized.
 *
 * <p>Verification evaluates, in order: no code or already verified, attempt budget spent, expiry,
 * code comparison. A match records the number on the user as verified.
 */
@Service
public class PhoneChallengeService {

  private static final Logger log = LoggerFactory.getLogger(PhoneChallengeService.class);

  private final PhoneVerificationRepository verificationRepository;
  private final UserRepository userRepository;
  private final AuthProperties.PhoneVerification policy;
  private final Clock clock;

  public PhoneChallengeService(
      PhoneVerificationRepository verificationRepository,
      UserRepository userRepository,
      AuthProperties properties,
      Clock clock) {
    this.verificationRepository = verificationRepository;
    this.userRepository = userRepository;
    this.policy = properties.phoneVerification();
    this.clock = clock;
  }

  /**
   * Creates or rewrites the user's challenge for {@code phone}.
   *
   * @param phone a normalized E.164 number
   * @return the raw code, which is not stored anywhere
   * @throws ResourceConflictException if another account already uses the number
   * @throws PhoneVerificationCooldownException if the previous code is younger than the cooldown
   */
  @Transactional
  public IssuedPhoneCode issue(UUID userId, String phone) {
    userRepository
        .findByIdForUpdate(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    if (userRepository.existsByPhoneAndIdNot(phone, userId)) {
      throw ResourceConflictException.phoneInUse();
    }

    Instant now = clock.instant();
    var existing = verificationRepository.findByUserIdForUpdate(userId);
    if (existing.isPresent()) {
      Duration remaining = existing.get().cooldownRemaining(now, policy.cooldown());
      if (!remaining.isZero()) {
        throw new PhoneVerificationCooldownException(remaining);
      }
    }

    Instant expiresAt = now.plus(policy.ttl());
    String code = SecureTokens.newNumericCode(OtpChallengeService.CODE_DIGITS);
    String codeHash = SecureTokens.sha256Hex(code);

    PhoneVerification verification;
    if (existing.isPresent()) {
      verification = existing.get();
      verification.reissue(phone, codeHash, now, expiresAt, policy.maxAttempts());
      log.info("Re-issued phone code {} for user {}", verification.getId(), userId);
    } else {
      verification =
          verificationRepository.saveAndFlush(
              new PhoneVerification(userId, phone, codeHash, now, expiresAt, policy.maxAttempts()));
      log.info("Issued phone code {} for user {}", verification.getId(), userId);
    }
    return new IssuedPhoneCode(verification.getId(), phone, code, expiresAt);
  }

  /**
   * Checks a presented code and, on success, sets the user's phone and marks it verified.
   *
   * @throws InvalidVerificationCodeException if there is no outstanding code or it is wrong with
   *     attempts remaining
   * @throws AttemptsExceededException if the attempt budget is or becomes spent
   * @throws ExpiredCredentialException if the code expired
   * @throws ResourceConflictException if another account verified the number in the meantime
   */
  @Transactional(noRollbackFor = VerificationFailedException.class)
  public User verify(UUID userId, String code) {
    Instant now = clock.instant();
    User user =
        userRepository
            .findByIdForUpdate(userId)
            .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    PhoneVerification verification =
        verificationRepository
            .findByUserIdForUpdate(userId)
            .orElseThrow(InvalidVerificationCodeException::unknownCode);

    if (verification.isVerified()) {
      throw InvalidVerificationCodeException.unknownCode();
    }
    if (verification.isExhausted()) {
      throw new AttemptsExceededException();
    }
    if (verification.isExpired(now)) {
      throw new ExpiredCredentialException("verification code");
    }

    if (!SecureTokens.hashesMatch(verification.getCodeHash(), SecureTokens.sha256Hex(code))) {
      verification.recordFailedAttempt();
      log.warn(
          "Wrong phone code for user {} (attempt {}/{})",
          userId,
          verification.getAttempts(),
          verification.getMaxAttempts());
      if (verification.isExhausted()) {
        throw new AttemptsExceededException();
      }
      throw InvalidVerificationCodeException.wrongCode(verification.remainingAttempts());
    }

    if (userRepository.existsByPhoneAndIdNot(verification.getPhone(), userId)) {
      throw ResourceConflictException.phoneInUse();
    }
    verification.markVerified(now);
    user.confirmPhone(verification.getPhone());

    log.info("Verified phone for user {}", userId);
    return user;
  }

  @Transactional(readOnly = true)
  public PhoneVerificationStatus status(UUID userId) {
    Instant now = clock.instant();
    return verificationRepository
        .findByUserId(userId)
        .map(
            v -> {
              Duration remaining = v.cooldownRemaining(now, policy.cooldown());
              boolean coolingDown = !remaining.isZero();
              return new PhoneVerificationStatus(
                  coolingDown,
                  PhoneVerificationCooldownException.secondsOf(remaining),
                  !coolingDown,
                  v.getIssuedAt(),
                  v.isPending(now));
            })
        .orElseGet(PhoneVerificationStatus::none);
  }
}
