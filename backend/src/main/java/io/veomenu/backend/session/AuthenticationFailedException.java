package io.veomenu.backend.session;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a session credential is absent, malformed, expired or revoked. The detail is kept
 * generic; the precise reason is only logged.
 */
public class AuthenticationFailedException extends ErrorResponseException {

  private final String reason;

  public AuthenticationFailedException(String reason) {
    super(HttpStatus.UNAUTHORIZED, createProblem(), null);
    this.reason = reason;
  }

  /** Internal reason for logs; never sent to the client. */
  public String getReason() {
    return reason;
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Authentication failed");
    problem.setDetail("Invalid or expired session credential");
    return problem;
  }
}
