package io.b2mash.eventops.task;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TaskController {

  private final TaskCascadeService taskCascadeService;

  public TaskController(TaskCascadeService taskCascadeService) {
    this.taskCascadeService = taskCascadeService;
  }

  @PostMapping("/api/events/{eventId}/tasks/generate")
  public ResponseEntity<List<TaskResponse>> generateTasks(@PathVariable UUID eventId) {
    var tasks = taskCascadeService.generateTasksForEvent(eventId);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(tasks.stream().map(TaskResponse::from).toList());
  }

  @GetMapping("/api/events/{eventId}/tasks")
  public ResponseEntity<List<TaskResponse>> listEventTasks(@PathVariable UUID eventId) {
    return ResponseEntity.ok(
        taskCascadeService.listTasksForEvent(eventId).stream().map(TaskResponse::from).toList());
  }

  @PostMapping("/api/events/{eventId}/tasks/recalculate")
  public ResponseEntity<DeadlineRecalculationResult> recalculate(
      @PathVariable UUID eventId, @Valid @RequestBody RecalculateRequest request) {
    return ResponseEntity.ok(
        taskCascadeService.recalculateDeadlinesForEvent(eventId, request.newDate()));
  }

  @GetMapping("/api/tasks")
  public ResponseEntity<List<TaskListItemResponse>> listTasks(
      @RequestParam(required = false) TaskStatus status,
      @RequestParam(required = false) TaskCategory category) {
    return ResponseEntity.ok(
        taskCascadeService.listTasks(status, category).stream()
            .map(TaskListItemResponse::from)
            .toList());
  }

  @GetMapping("/api/tasks/{taskId}")
  public ResponseEntity<TaskResponse> getTask(@PathVariable UUID taskId) {
    return ResponseEntity.ok(TaskResponse.from(taskCascadeService.getTask(taskId)));
  }

  @PostMapping("/api/tasks/{taskId}/complete")
  public ResponseEntity<CompleteTaskResponse> completeTask(
      @PathVariable UUID taskId, @Valid @RequestBody CompleteTaskRequest request) {
    var result =
        taskCascadeService.completeTask(
            taskId, request.completionData(), request.actorEmail(), request.enrichment());
    return ResponseEntity.ok(
        new CompleteTaskResponse(
            TaskResponse.from(result.task()), result.orderId(), result.followUpTaskId()));
  }

  // --- DTOs ---

  public record RecalculateRequest(@NotNull LocalDate newDate) {}

  public record CompleteTaskRequest(
      @Valid TaskCompletionData completionData,
      @NotBlank @Email String actorEmail,
      OrderEnrichment enrichment) {}

  public record CompleteTaskResponse(TaskResponse task, UUID orderId, UUID followUpTaskId) {}

  public record TaskResponse(
      UUID id,
      UUID eventId,
      String templateId,
      TaskCategory category,
      String name,
      String description,
      CompletionKind completionKind,
      Integer offsetDays,
      LocalDate deadline,
      TaskStatus status,
      Instant completedAt,
      String completedBy,
      Map<String, Object> completionData,
      UUID orderId,
      UUID parentTaskId) {

    public static TaskResponse from(Task task) {
      return new TaskResponse(
          task.getId(),
          task.getEventId(),
          task.getTemplateId(),
          task.getCategory(),
          task.getName(),
          task.getDescription(),
          task.getCompletionKind(),
          task.getOffsetDays(),
          task.getDeadline(),
          task.getStatus(),
          task.getCompletedAt(),
          task.getCompletedBy(),
          task.getCompletionData(),
          task.getOrderId(),
          task.getParentTaskId());
    }
  }

  public record TaskListItemResponse(
      TaskResponse task,
      String schoolName,
      LocalDate eventDate,
      long daysUntilDeadline,
      boolean overdue) {

    public static TaskListItemResponse from(TaskView view) {
      return new TaskListItemResponse(
          TaskResponse.from(view.task()),
          view.schoolName(),
          view.eventDate(),
          view.daysUntilDeadline(),
          view.overdue());
    }
  }
}
