package io.b2mash.eventops.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Operation not allowed in the current state of an event, task or order (HTTP 400). */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, problem(title, detail), null);
  }

  /** Deadlines are anchored on the event date, so an undated event cannot carry tasks. */
  public static InvalidStateException eventWithoutDate(UUID eventId, String operation) {
    return new InvalidStateException(
        "Event has no date", "Cannot " + operation + " for event " + eventId + " without a date");
  }

  private static ProblemDetail problem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
