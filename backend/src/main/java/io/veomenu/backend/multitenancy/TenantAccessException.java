package io.veomenu.backend.multitenancy;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base for tenant resolution failures. Every subclass renders the same 403 body so a caller
 * cannot tell a missing tenant, a foreign tenant and a closed tenant apart; the cause is only
 * available through {@link #getReason()} for logging.
 */
public abstract class TenantAccessException extends ErrorResponseException {

  private final String reason;

  protected TenantAccessException(String reason) {
    super(HttpStatus.FORBIDDEN, createProblem(), null);
    this.reason = reason;
  }

  public String getReason() {
    return reason;
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("You do not have access to this instance");
    return problem;
  }
}
