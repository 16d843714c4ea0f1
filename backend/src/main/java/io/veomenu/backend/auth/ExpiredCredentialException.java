package io.veomenu.backend.auth;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

public class ExpiredCredentialException extends VerificationFailedException {

  public ExpiredCredentialException(String credential) {
    super(HttpStatus.GONE, createProblem(credential));
  }

  private static ProblemDetail createProblem(String credential) {
    var problem = ProblemDetail.forStatus(HttpStatus.GONE);
    problem.setTitle("Credential expired");
    problem.setDetail("The " + credential + " has expired. Please request a new one.");
    return problem;
  }
}
