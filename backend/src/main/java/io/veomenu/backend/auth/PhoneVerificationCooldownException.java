package io.veomenu.backend.auth;

import java.time.Duration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A phone code was requested before the previous one left its cooldown. */
public class PhoneVerificationCooldownException extends ErrorResponseException {

  private final long remainingSeconds;

  public PhoneVerificationCooldownException(Duration remaining) {
    super(HttpStatus.TOO_MANY_REQUESTS, createProblem(secondsOf(remaining)), null);
    this.remainingSeconds = secondsOf(remaining);
    getHeaders().set(HttpHeaders.RETRY_AFTER, Long.toString(remainingSeconds));
  }

  public long getRemainingSeconds() {
    return remainingSeconds;
  }

  // Rounded up so a client waiting this long is never refused again.
  static long secondsOf(Duration remaining) {
    long seconds = remaining.getSeconds();
    return remaining.getNano() > 0 ? seconds + 1 : seconds;
  }

  private static ProblemDetail createProblem(long seconds) {
    var problem = ProblemDetail.forStatus(HttpStatus.TOO_MANY_REQUESTS);
    problem.setTitle("Verification cooldown");
    problem.setDetail(
        "Please wait "
            + seconds / 60
            + " minutes and "
            + seconds % 60
            + " seconds before requesting another code.");
    problem.setProperty("cooldownRemaining", seconds);
    return problem;
  }
}
