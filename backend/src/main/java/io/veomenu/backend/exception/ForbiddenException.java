package io.veomenu.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * An authenticated caller lacks the role for an action inside an instance, or tried to change the
 * owner. Tenant resolution failures use {@code TenantAccessException} instead.
 */
public class ForbiddenException extends ErrorResponseException {

  private ForbiddenException(String title, String detail) {
    super(HttpStatus.FORBIDDEN, createProblem(title, detail), null);
  }

  public static ForbiddenException accessDenied() {
    return new ForbiddenException("Access denied", "Access is denied");
  }

  /** @param requiredRole name of the lowest role allowed to perform the action */
  public static ForbiddenException insufficientRole(String requiredRole) {
    return new ForbiddenException(
        "Insufficient role", "This action requires the " + requiredRole + " role or higher");
  }

  /** @param detail what was attempted on the owner's membership */
  public static ForbiddenException ownerImmutable(String detail) {
    return new ForbiddenException("Owner is immutable", detail);
  }

  public static ForbiddenException roleNotAssignable(String role) {
    return new ForbiddenException(
        "Role not assignable",
        "The " + role.toLowerCase() + " role cannot be granted to another member");
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
