package io.b2mash.eventops.exception;

import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Lookup by id found nothing (HTTP 404). The problem body names the resource type and id. */
public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(HttpStatus.NOT_FOUND, problem(resourceType, id), null);
  }

  private static ProblemDetail problem(String resourceType, Object id) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(resourceType + " not found");
    problem.setDetail("No " + resourceType.toLowerCase(Locale.ROOT) + " found with id " + id);
    problem.setProperty("resource", resourceType);
    problem.setProperty("id", String.valueOf(id));
    return problem;
  }
}
