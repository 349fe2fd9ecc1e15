package io.b2mash.eventops.task;

import io.b2mash.eventops.audit.AuditEventBuilder;
import io.b2mash.eventops.audit.AuditService;
import io.b2mash.eventops.event.SchoolEvent;
import io.b2mash.eventops.event.SchoolEventRepository;
import io.b2mash.eventops.exception.InvalidStateException;
import io.b2mash.eventops.exception.ResourceNotFoundException;
import io.b2mash.eventops.schedule.EventDateCalculator;
import io.b2mash.eventops.schedule.UrgencyOrder;
import io.b2mash.eventops.supplierorder.AggregateOrder;
import io.b2mash.eventops.supplierorder.AggregateOrderRepository;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Generates the per-event task checklist, completes tasks (creating aggregate orders and shipping
 * follow-ups as the task's template requires) and moves pending deadlines when an event is
 * rescheduled.
 *
 * <p>Completion is retry-safe: an order already linked to the task and a follow-up already spawned
 * from it are reused instead of being created a second time.
 */
@Service
public class TaskCascadeService {

  private static final Logger log = LoggerFactory.getLogger(TaskCascadeService.class);

  private final TaskRepository taskRepository;
  private final SchoolEventRepository eventRepository;
  private final AggregateOrderRepository aggregateOrderRepository;
  private final TaskTemplateRegistry templateRegistry;
  private final EventDateCalculator dateCalculator;
  private final AuditService auditService;

  public TaskCascadeService(
      TaskRepository taskRepository,
      SchoolEventRepository eventRepository,
      AggregateOrderRepository aggregateOrderRepository,
      TaskTemplateRegistry templateRegistry,
      EventDateCalculator dateCalculator,
      AuditService auditService) {
    this.taskRepository = taskRepository;
    this.eventRepository = eventRepository;
    this.aggregateOrderRepository = aggregateOrderRepository;
    this.templateRegistry = templateRegistry;
    this.dateCalculator = dateCalculator;
    this.auditService = auditService;
  }

  /**
   * Creates one pending task per registry template, due at {@code event date + offset}. Templates
   * already materialised for the event are skipped, so only newly created tasks are returned.
   */
  @Transactional
  public List<Task> generateTasksForEvent(UUID eventId) {
    var event =
        eventRepository
            .findById(eventId)
            .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
    if (event.getEventDate() == null) {
      throw InvalidStateException.eventWithoutDate(eventId, "generate tasks");
    }

    Set<String> existingTemplateIds =
        taskRepository.findByEventIdOrderByDeadlineAsc(eventId).stream()
            .map(Task::getTemplateId)
            .collect(Collectors.toSet());

    var tasks = new ArrayList<Task>();
    for (var template : templateRegistry.all()) {
      if (existingTemplateIds.contains(template.id())) {
        continue;
      }
      var deadline = dateCalculator.deadlineFor(event.getEventDate(), template.offsetDays());
      tasks.add(Task.fromTemplate(eventId, template, deadline));
    }

    if (tasks.isEmpty()) {
      log.info("All task templates already generated for event {}", eventId);
      return List.of();
    }

    var saved = taskRepository.saveAll(tasks);
    log.info("Generated {} tasks for event {}", saved.size(), eventId);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("event.tasks_generated")
            .entityType("event")
            .entityId(eventId)
            .details(
                Map.of(
                    "task_count", saved.size(),
                    "template_ids", saved.stream().map(Task::getTemplateId).toList()))
            .build());

    return saved;
  }

  @Transactional
  public TaskCompletionResult completeTask(
      UUID taskId, TaskCompletionData completionData, String actor, OrderEnrichment enrichment) {
    var task =
        taskRepository
            .findById(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    var data = completionData != null ? completionData : TaskCompletionData.empty();
    var extra = enrichment != null ? enrichment : OrderEnrichment.none();
    var template = templateRegistry.find(task.getTemplateId()).orElse(null);

    boolean alreadyCompleted = task.getStatus() == TaskStatus.COMPLETED;
    if (alreadyCompleted) {
      log.info("Task {} is already completed; checking for missing cascade steps", taskId);
    }

    UUID orderId = task.getOrderId();
    if (template != null && template.createsOrder()) {
      orderId = findOrCreateOrder(task, data, extra).getId();
    }

    if (!alreadyCompleted) {
      task.complete(actor, data.toMap(), orderId);
    } else if (orderId != null && !orderId.equals(task.getOrderId())) {
      task.linkOrder(orderId);
    }
    task = taskRepository.save(task);

    UUID followUpTaskId = null;
    if (template != null && template.createsFollowUp() && orderId != null) {
      followUpTaskId = findOrCreateFollowUp(task, template, orderId).getId();
    }

    if (!alreadyCompleted) {
      log.info(
          "Completed task {} ({}) for event {} by {}",
          taskId,
          task.getTemplateId(),
          task.getEventId(),
          actor);

      var details = new LinkedHashMap<String, Object>();
      details.put("template_id", task.getTemplateId());
      details.put("event_id", task.getEventId().toString());
      if (orderId != null) {
        details.put("order_id", orderId.toString());
      }
      if (followUpTaskId != null) {
        details.put("follow_up_task_id", followUpTaskId.toString());
      }
      auditService.log(
          AuditEventBuilder.builder()
              .eventType("task.completed")
              .entityType("task")
              .entityId(taskId)
              .actor(actor)
              .details(details)
              .build());
    }

    return new TaskCompletionResult(task, orderId, followUpTaskId);
  }

  /**
   * Moves every pending, event-anchored task of the event to {@code newDate + offset}. Completed,
   * manual and follow-up tasks keep their deadline.
   */
  @Transactional
  public DeadlineRecalculationResult recalculateDeadlinesForEvent(UUID eventId, LocalDate newDate) {
    var pending = taskRepository.findByEventIdAndStatus(eventId, TaskStatus.PENDING);
    var updated = new ArrayList<Task>();
    for (var task : pending) {
      if (task.recalculateDeadline(newDate)) {
        updated.add(task);
      }
    }
    if (!updated.isEmpty()) {
      taskRepository.saveAll(updated);
    }

    var taskIds = updated.stream().map(Task::getId).toList();
    log.info(
        "Recalculated {} of {} pending task deadlines for event {} (new date {})",
        updated.size(),
        pending.size(),
        eventId,
        newDate);
    return new DeadlineRecalculationResult(updated.size(), taskIds);
  }

  @Transactional(readOnly = true)
  public Task getTask(UUID taskId) {
    return taskRepository
        .findById(taskId)
        .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
  }

  @Transactional(readOnly = true)
  public List<Task> listTasksForEvent(UUID eventId) {
    return taskRepository.findByEventIdOrderByDeadlineAsc(eventId);
  }

  /** Staff task list across events, most urgent first. */
  @Transactional(readOnly = true)
  public List<TaskView> listTasks(TaskStatus status, TaskCategory category) {
    var tasks = taskRepository.findWithFilters(status, category);
    var eventIds = tasks.stream().map(Task::getEventId).collect(Collectors.toSet());
    Map<UUID, SchoolEvent> events =
        eventRepository.findAllById(eventIds).stream()
            .collect(Collectors.toMap(SchoolEvent::getId, Function.identity()));

    return tasks.stream()
        .map(
            task -> {
              var event = events.get(task.getEventId());
              long days = dateCalculator.daysUntil(task.getDeadline());
              return new TaskView(
                  task,
                  event != null ? event.getSchoolName() : null,
                  event != null ? event.getEventDate() : null,
                  days,
                  days < 0 && task.getStatus() == TaskStatus.PENDING);
            })
        .sorted(UrgencyOrder.mostUrgentFirst(TaskView::daysUntilDeadline))
        .toList();
  }

  private AggregateOrder findOrCreateOrder(
      Task task, TaskCompletionData data, OrderEnrichment enrichment) {
    var existing = aggregateOrderRepository.findBySourceTaskId(task.getId());
    if (existing.isPresent()) {
      log.info("Reusing aggregate order {} for task {}", existing.get().getId(), task.getId());
      return existing.get();
    }
    var order =
        new AggregateOrder(
            task.getEventId(),
            task.getId(),
            data.amount(),
            dateCalculator.today(),
            enrichment.sourceOrderIds(),
            enrichment.contents());
    order = aggregateOrderRepository.save(order);
    log.info("Created aggregate order {} for task {}", order.getId(), task.getId());
    return order;
  }

  private Task findOrCreateFollowUp(Task parent, TaskTemplate template, UUID orderId) {
    var existing = taskRepository.findFirstByParentTaskIdOrderByCreatedAtAsc(parent.getId());
    if (existing.isPresent()) {
      return existing.get();
    }
    var followUp =
        Task.followUpOf(
            parent, templateRegistry.followUpTemplateId(template), orderId, dateCalculator.today());
    followUp = taskRepository.save(followUp);
    log.info("Created follow-up task {} for task {}", followUp.getId(), parent.getId());
    return followUp;
  }
}
