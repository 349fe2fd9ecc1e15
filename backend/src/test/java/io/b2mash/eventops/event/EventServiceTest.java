package io.b2mash.eventops.event;

import static io.b2mash.eventops.testutil.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.eventops.audit.AuditEventRecord;
import io.b2mash.eventops.audit.AuditService;
import io.b2mash.eventops.exception.InvalidStateException;
import io.b2mash.eventops.task.DeadlineRecalculationResult;
import io.b2mash.eventops.task.TaskCascadeService;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class EventServiceTest {

  private static final String ACTOR = "ops@minimusiker.de";
  private static final LocalDate OLD_DATE = LocalDate.of(2026, 3, 15);
  private static final LocalDate NEW_DATE = LocalDate.of(2026, 4, 20);

  @Mock private SchoolEventRepository eventRepository;
  @Mock private TaskCascadeService taskCascadeService;
  @Mock private AuditService auditService;
  @Mock private TransactionTemplate transactionTemplate;

  private EventService service;
  private SchoolEvent event;

  @BeforeEach
  void setUp() {
    service =
        new EventService(eventRepository, taskCascadeService, auditService, transactionTemplate);
    event = withId(new SchoolEvent("EVT-1", "Grundschule Am Park", OLD_DATE), UUID.randomUUID());
    when(transactionTemplate.execute(any()))
        .thenAnswer(inv -> inv.<TransactionCallback<?>>getArgument(0).doInTransaction(null));
  }

  @Test
  void reschedule_movesDateAndRecalculatesTasks() {
    when(eventRepository.findById(event.getId())).thenReturn(Optional.of(event));
    when(eventRepository.save(event)).thenReturn(event);
    when(taskCascadeService.recalculateDeadlinesForEvent(event.getId(), NEW_DATE))
        .thenReturn(new DeadlineRecalculationResult(4, List.of()));

    var result = service.rescheduleEvent(event.getId(), NEW_DATE, true, ACTOR);

    assertThat(event.getEventDate()).isEqualTo(NEW_DATE);
    assertThat(result.previousDate()).isEqualTo(OLD_DATE);
    assertThat(result.tasksRecalculated()).isEqualTo(4);
    assertThat(result.recalculationFailed()).isFalse();

    var captor = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(captor.capture());
    assertThat(captor.getValue().eventType()).isEqualTo("event.rescheduled");
    assertThat(captor.getValue().details()).containsEntry("new_date", "2026-04-20");
  }

  @Test
  void reschedule_keepsDateWhenRecalculationFails() {
    when(eventRepository.findById(event.getId())).thenReturn(Optional.of(event));
    when(eventRepository.save(event)).thenReturn(event);
    when(taskCascadeService.recalculateDeadlinesForEvent(event.getId(), NEW_DATE))
        .thenThrow(new IllegalStateException("db down"));

    var result = service.rescheduleEvent(event.getId(), NEW_DATE, true, ACTOR);

    assertThat(result.event().getEventDate()).isEqualTo(NEW_DATE);
    assertThat(result.recalculationFailed()).isTrue();
  }

  @Test
  void reschedule_canSkipRecalculation() {
    when(eventRepository.findById(event.getId())).thenReturn(Optional.of(event));
    when(eventRepository.save(event)).thenReturn(event);

    var result = service.rescheduleEvent(event.getId(), NEW_DATE, false, ACTOR);

    assertThat(result.tasksRecalculated()).isZero();
    verify(taskCascadeService, never()).recalculateDeadlinesForEvent(any(), any());
  }

  @Test
  void reschedule_rejectsCancelledEvent() {
    event.cancel();
    when(eventRepository.findById(event.getId())).thenReturn(Optional.of(event));

    assertThatThrownBy(() -> service.rescheduleEvent(event.getId(), NEW_DATE, true, ACTOR))
        .isInstanceOf(InvalidStateException.class);
    verify(auditService, never()).log(any());
  }

  @Test
  void cancel_marksEventCancelled() {
    when(eventRepository.findById(event.getId())).thenReturn(Optional.of(event));
    when(eventRepository.save(event)).thenReturn(event);

    var cancelled = service.cancelEvent(event.getId(), ACTOR);

    assertThat(cancelled.getStatus()).isEqualTo(EventStatus.CANCELLED);
    assertThat(cancelled.isActive()).isFalse();
  }
}
