package io.b2mash.eventops.event;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EventController {

  private final EventService eventService;

  public EventController(EventService eventService) {
    this.eventService = eventService;
  }

  @GetMapping("/api/events/{eventId}")
  public ResponseEntity<EventResponse> getEvent(@PathVariable UUID eventId) {
    return ResponseEntity.ok(EventResponse.from(eventService.getEvent(eventId)));
  }

  /** Moves the event date; pending task deadlines follow unless {@code recalculateTasks=false}. */
  @PatchMapping("/api/events/{eventId}/date")
  public ResponseEntity<RescheduleResponse> reschedule(
      @PathVariable UUID eventId, @Valid @RequestBody RescheduleRequest request) {
    boolean recalculate = request.recalculateTasks() == null || request.recalculateTasks();
    var result =
        eventService.rescheduleEvent(eventId, request.newDate(), recalculate, request.actorEmail());
    return ResponseEntity.ok(
        new RescheduleResponse(
            EventResponse.from(result.event()),
            result.previousDate(),
            result.tasksRecalculated(),
            result.recalculationFailed()));
  }

  @PostMapping("/api/events/{eventId}/cancel")
  public ResponseEntity<EventResponse> cancel(
      @PathVariable UUID eventId, @RequestBody(required = false) CancelRequest request) {
    var actor = request != null ? request.actorEmail() : null;
    return ResponseEntity.ok(EventResponse.from(eventService.cancelEvent(eventId, actor)));
  }

  // --- DTOs ---

  public record RescheduleRequest(
      @NotNull LocalDate newDate, Boolean recalculateTasks, String actorEmail) {}

  public record CancelRequest(String actorEmail) {}

  public record RescheduleResponse(
      EventResponse event,
      LocalDate previousDate,
      int tasksRecalculated,
      boolean recalculationFailed) {}

  public record EventResponse(
      UUID id,
      String eventCode,
      String schoolName,
      LocalDate eventDate,
      EventStatus status,
      EventTier tier,
      boolean kita,
      boolean under100) {

    public static EventResponse from(SchoolEvent event) {
      return new EventResponse(
          event.getId(),
          event.getEventCode(),
          event.getSchoolName(),
          event.getEventDate(),
          event.getStatus(),
          event.getTier(),
          event.isKita(),
          event.isUnder100());
    }
  }
}
