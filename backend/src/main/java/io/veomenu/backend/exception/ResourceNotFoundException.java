package io.veomenu.backend.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A user, member, instance or session that is absent or not visible to the caller. Lookups by
 * email never echo the address back.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  private final String resourceType;

  public ResourceNotFoundException(String resourceType, UUID id) {
    this(resourceType, "No " + resourceType.toLowerCase() + " found with id " + id);
  }

  private ResourceNotFoundException(String resourceType, String detail) {
    super(HttpStatus.NOT_FOUND, createProblem(resourceType + " not found", detail), null);
    this.resourceType = resourceType;
  }

  public static ResourceNotFoundException byEmail(String resourceType) {
    return new ResourceNotFoundException(
        resourceType, "No " + resourceType.toLowerCase() + " found with this email");
  }

  public String getResourceType() {
    return resourceType;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
