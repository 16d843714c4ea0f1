package io.veomenu.backend.auth;

import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base for rejections produced by the one-time code and magic-link state machines. Verifying
 * transactions do not roll back on these, so state changes made while rejecting (a spent attempt)
 * are committed.
 */
public abstract class VerificationFailedException extends ErrorResponseException {

  protected VerificationFailedException(HttpStatusCode status, ProblemDetail problem) {
    super(status, problem, null);
  }
}
