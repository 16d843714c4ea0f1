package io.veomenu.backend.auth;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/** The challenge used up its attempt budget; even the correct code is refused from now on. */
public class AttemptsExceededException extends VerificationFailedException {

  public AttemptsExceededException() {
    super(HttpStatus.GONE, createProblem());
  }

  private static ProblemDetail createProblem() {
    var problem = ProblemDetail.forStatus(HttpStatus.GONE);
    problem.setTitle("Too many attempts");
    problem.setDetail("Maximum verification attempts exceeded. Please request a new code.");
    return problem;
  }
}
