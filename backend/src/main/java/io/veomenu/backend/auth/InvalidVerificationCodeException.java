package io.veomenu.backend.auth;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * The presented code or token does not match, does not exist, or was already used. Wrong codes
 * report how many attempts are left; unknown and consumed credentials do not.
 */
public class InvalidVerificationCodeException extends VerificationFailedException {

  private final Integer remainingAttempts;

  private InvalidVerificationCodeException(String title, String detail, Integer remaining) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail, remaining));
    this.remainingAttempts = remaining;
  }

  public static InvalidVerificationCodeException wrongCode(int remainingAttempts) {
    return new InvalidVerificationCodeException(
        "Invalid verification code",
        "The verification code is invalid or has already been used",
        remainingAttempts);
  }

  public static InvalidVerificationCodeException unknownCode() {
    return new InvalidVerificationCodeException(
        "Invalid verification code",
        "The verification code is invalid or has already been used",
        null);
  }

  public static InvalidVerificationCodeException invalidMagicLink() {
    return new InvalidVerificationCodeException(
        "Invalid magic link", "The magic link is invalid or has already been used", null);
  }

  /** Attempts left before the challenge is exhausted, or null when not applicable. */
  public Integer getRemainingAttempts() {
    return remainingAttempts;
  }

  private static ProblemDetail createProblem(String title, String detail, Integer remaining) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    if (remaining != null) {
      problem.setProperty("remainingAttempts", remaining);
    }
    return problem;
  }
}
