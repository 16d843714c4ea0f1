package io.veomenu.backend.auth;

import io.veomenu.backend.config.AuthProperties;
import io.veomenu.backend.exception.InvalidRequestException;
import io.veomenu.backend.security.SecureTokens;
import io.veomenu.backend.user.User;
import io.veomenu.backend.user.UserRepository;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and verifies the six-digit codes that confirm a registration. One {@link OtpChallenge}
 * row exists per (email, phone); every read that may change it takes a row lock first, so
 * concurrent verifications of the same challenge are serialized.
 *
 * <p>Verification evaluates, in order: unknown or already verified, attempt budget spent, expiry,
 * code comparison. A match marks the challenge verified and creates the {@link User} in the same
 * transaction.
 */
@Service
public class OtpChallengeService {

  private static final Logger log = LoggerFactory.getLogger(OtpChallengeService.class);
  static final int CODE_DIGITS = 6;

  private final OtpChallengeRepository challengeRepository;
  private final UserRepository userRepository;
  private final AuthProperties.Otp policy;
  private final Clock clock;

  public OtpChallengeService(
      OtpChallengeRepository challengeRepository,
      UserRepository userRepository,
      AuthProperties properties,
      Clock clock) {
    this.challengeRepository = challengeRepository;
    this.userRepository = userRepository;
    this.policy = properties.otp();
    this.clock = clock;
  }

  /**
   * Creates or supersedes the challenge for the registration's (email, phone).
   *
   * @return the raw code, which is not stored anywhere
   * @throws DuplicateRegistrationException if an account already uses the email
   */
  @Transactional
  public IssuedCode issue(PendingRegistration registration, String createdIp) {
    if (userRepository.existsByEmail(registration.email())) {
      throw new DuplicateRegistrationException();
    }

    Instant now = clock.instant();
    Instant expiresAt = now.plus(policy.ttl());
    String code = SecureTokens.newNumericCode(CODE_DIGITS);
    String codeHash = SecureTokens.sha256Hex(code);

    var existing =
        challengeRepository.findByEmailAndPhoneForUpdate(
            registration.email(), registration.phone());
    if (existing.isPresent()) {
      OtpChallenge challenge = existing.get();
      challenge.updateRegistration(registration.name(), registration.language());
      challenge.reissue(codeHash, now, expiresAt, policy.maxAttempts(), createdIp);
      log.info("Re-issued registration code for challenge {}", challenge.getId());
    } else {
      var challenge =
          new OtpChallenge(registration, codeHash, now, expiresAt, policy.maxAttempts(), createdIp);
      challenge = challengeRepository.saveAndFlush(challenge);
      log.info("Issued registration code for challenge {}", challenge.getId());
    }
    return new IssuedCode(registration, code, expiresAt);
  }

  /**
   * Issues a new code for an existing pending registration, invalidating the previous one.
   *
   * @throws InvalidRequestException if there is no pending registration for the pair
   */
  @Transactional
  public IssuedCode resend(String email, String phone, String createdIp) {
    OtpChallenge challenge =
        challengeRepository
            .findByEmailAndPhoneForUpdate(email, phone)
            .filter(c -> !c.isVerified())
            .orElseThrow(
                () ->
                    new InvalidRequestException(
                        "No pending registration",
                        "No pending registration found for this email and phone"));

    Instant now = clock.instant();
    Instant expiresAt = now.plus(policy.ttl());
    String code = SecureTokens.newNumericCode(CODE_DIGITS);
    String codeHash = SecureTokens.sha256Hex(code);
    challenge.reissue(codeHash, now, expiresAt, policy.maxAttempts(), createdIp);

    log.info("Resent registration code for challenge {}", challenge.getId());
    return new IssuedCode(challenge.toRegistration(), code, expiresAt);
  }

  /**
   * Checks a presented code and, on success, creates the account.
   *
   * @throws InvalidVerificationCodeException if no pending challenge exists, it was already
   *     verified, or the code is wrong with attempts remaining
   * @throws AttemptsExceededException if the attempt budget is or becomes spent
   * @throws ExpiredCredentialException if the code expired
   * @throws org.springframework.dao.DataIntegrityViolationException if the email was registered
   *     concurrently; nothing is committed in that case
   */
  @Transactional(noRollbackFor = VerificationFailedException.class)
  public User verify(String email, String phone, String code) {
    Instant now = clock.instant();
    OtpChallenge challenge =
        challengeRepository
            .findByEmailAndPhoneForUpdate(email, phone)
            .orElseThrow(InvalidVerificationCodeException::unknownCode);

    if (challenge.isVerified()) {
      throw InvalidVerificationCodeException.unknownCode();
    }
    if (challenge.isExhausted()) {
      throw new AttemptsExceededException();
    }
    if (challenge.isExpired(now)) {
      throw new ExpiredCredentialException("verification code");
    }

    if (!SecureTokens.hashesMatch(challenge.getCodeHash(), SecureTokens.sha256Hex(code))) {
      challenge.recordFailedAttempt();
      log.warn(
          "Wrong registration code for challenge {} (attempt {}/{})",
          challenge.getId(),
          challenge.getAttempts(),
          challenge.getMaxAttempts());
      if (challenge.isExhausted()) {
        throw new AttemptsExceededException();
      }
      throw InvalidVerificationCodeException.wrongCode(challenge.remainingAttempts());
    }

    challenge.markVerified(now);
    var user =
        new User(
            challenge.getEmail(),
            challenge.getName(),
            challenge.getPhone(),
            challenge.getLanguage(),
            now);
    user = userRepository.saveAndFlush(user);

    log.info("Verified challenge {} and created user {}", challenge.getId(), user.getId());
    return user;
  }
}
