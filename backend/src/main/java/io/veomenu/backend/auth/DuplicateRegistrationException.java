package io.veomenu.backend.auth;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class DuplicateRegistrationException extends ErrorResponseException {

  public DuplicateRegistrationException() {
    super(HttpStatus.BAD_REQUEST, createProblem(), null);
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Registration failed");
    problem.setDetail("An account with this email already exists");
    return problem;
  }
}
