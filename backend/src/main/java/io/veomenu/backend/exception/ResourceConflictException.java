package io.veomenu.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The request collides with state another account or membership already holds. */
public class ResourceConflictException extends ErrorResponseException {

  private ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(title, detail), null);
  }

  public static ResourceConflictException alreadyMember() {
    return new ResourceConflictException(
        "Already a member", "User is already a member of this instance");
  }

  public static ResourceConflictException phoneInUse() {
    return new ResourceConflictException(
        "Phone number in use", "Phone number is already registered with another account");
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
