package io.b2mash.eventops.event;

import io.b2mash.eventops.audit.AuditEventBuilder;
import io.b2mash.eventops.audit.AuditService;
import io.b2mash.eventops.exception.InvalidStateException;
import io.b2mash.eventops.exception.ResourceNotFoundException;
import io.b2mash.eventops.task.TaskCascadeService;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class EventService {

  private static final Logger log = LoggerFactory.getLogger(EventService.class);

  private final SchoolEventRepository eventRepository;
  private final TaskCascadeService taskCascadeService;
  private final AuditService auditService;
  private final TransactionTemplate transactionTemplate;

  public EventService(
      SchoolEventRepository eventRepository,
      TaskCascadeService taskCascadeService,
      AuditService auditService,
      TransactionTemplate transactionTemplate) {
    this.eventRepository = eventRepository;
    this.taskCascadeService = taskCascadeService;
    this.auditService = auditService;
    this.transactionTemplate = transactionTemplate;
  }

  public SchoolEvent getEvent(UUID eventId) {
    return eventRepository
        .findById(eventId)
        .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
  }

  /**
   * Moves the event to {@code newDate}. Pending task deadlines follow unless {@code
   * recalculateTasks} is false. A failed recalculation is logged and reported in the result; the
   * date change itself stays committed.
   */
  public RescheduleResult rescheduleEvent(
      UUID eventId, LocalDate newDate, boolean recalculateTasks, String actor) {
    var change =
        transactionTemplate.execute(
            tx -> {
              var event = getEvent(eventId);
              if (!event.isActive()) {
                throw new InvalidStateException(
                    "Event not active",
                    "Cannot reschedule event " + eventId + " in status " + event.getStatus());
              }
              var previousDate = event.getEventDate();
              event.reschedule(newDate);
              return new DateChange(eventRepository.save(event), previousDate);
            });
    log.info("Rescheduled event {} from {} to {}", eventId, change.previousDate(), newDate);

    int recalculated = 0;
    boolean failed = false;
    if (recalculateTasks) {
      try {
        recalculated =
            taskCascadeService.recalculateDeadlinesForEvent(eventId, newDate).updatedCount();
      } catch (RuntimeException e) {
        failed = true;
        log.error("Failed to recalculate task deadlines for event {}", eventId, e);
      }
    }

    var details = new HashMap<String, Object>();
    details.put(
        "previous_date", change.previousDate() != null ? change.previousDate().toString() : null);
    details.put("new_date", newDate.toString());
    details.put("tasks_recalculated", recalculated);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("event.rescheduled")
            .entityType("event")
            .entityId(eventId)
            .actor(actor)
            .details(details)
            .build());

    return new RescheduleResult(change.event(), change.previousDate(), recalculated, failed);
  }

  public SchoolEvent cancelEvent(UUID eventId, String actor) {
    var event =
        transactionTemplate.execute(
            tx -> {
              var e = getEvent(eventId);
              e.cancel();
              return eventRepository.save(e);
            });
    log.info("Cancelled event {}", eventId);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("event.cancelled")
            .entityType("event")
            .entityId(eventId)
            .actor(actor)
            .details(Map.of("school_name", event.getSchoolName()))
            .build());
    return event;
  }

  private record DateChange(SchoolEvent event, LocalDate previousDate) {}
}
