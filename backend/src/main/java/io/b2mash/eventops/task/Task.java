package io.b2mash.eventops.task;

import io.b2mash.eventops.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "tasks")
public class Task {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "event_id", nullable = false)
  private UUID eventId;

  @Column(name = "template_id", nullable = false, length = 100)
  private String templateId;

  @Enumerated(EnumType.STRING)
  @Column(name = "category", nullable = false, length = 30)
  private TaskCategory category;

  @Column(name = "name", nullable = false, length = 300)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "completion_kind", nullable = false, length = 20)
  private CompletionKind completionKind;

  @Column(name = "offset_days")
  private Integer offsetDays;

  @Column(name = "deadline", nullable = false)
  private LocalDate deadline;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TaskStatus status;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "completed_by", length = 320)
  private String completedBy;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "completion_data", columnDefinition = "jsonb")
  private Map<String, Object> completionData = new HashMap<>();

  @Column(name = "order_id")
  private UUID orderId;

  @Column(name = "parent_task_id")
  private UUID parentTaskId;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Task() {}

  public Task(
      UUID eventId,
      String templateId,
      TaskCategory category,
      String name,
      String description,
      CompletionKind completionKind,
      Integer offsetDays,
      LocalDate deadline) {
    this.eventId = eventId;
    this.templateId = templateId;
    this.category = category;
    this.name = name;
    this.description = description;
    this.completionKind = completionKind;
    this.offsetDays = offsetDays;
    this.deadline = deadline;
    this.status = TaskStatus.PENDING;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Creates the pending task for one registry template, due at {@code deadline}. */
  public static Task fromTemplate(UUID eventId, TaskTemplate template, LocalDate deadline) {
    return new Task(
        eventId,
        template.id(),
        template.category(),
        template.name(),
        template.description(),
        template.completionKind(),
        template.offsetDays(),
        deadline);
  }

  /**
   * Creates the shipping task spawned by completing {@code parent}. The follow-up is due on the
   * day it is created and is linked to the same aggregate order.
   */
  public static Task followUpOf(Task parent, String templateId, UUID orderId, LocalDate due) {
    var followUp =
        new Task(
            parent.getEventId(),
            templateId,
            TaskCategory.SHIPPING,
            TaskTemplateRegistry.FOLLOW_UP_NAME,
            TaskTemplateRegistry.FOLLOW_UP_DESCRIPTION + " - " + parent.getName(),
            CompletionKind.CHECKBOX,
            0,
            due);
    followUp.parentTaskId = parent.getId();
    followUp.orderId = orderId;
    return followUp;
  }

  public void complete(String actor, Map<String, Object> data, UUID linkedOrderId) {
    requireTransition(TaskStatus.COMPLETED, "complete");
    this.status = TaskStatus.COMPLETED;
    this.completedAt = Instant.now();
    this.completedBy = actor;
    this.completionData = data != null ? new HashMap<>(data) : new HashMap<>();
    if (linkedOrderId != null) {
      this.orderId = linkedOrderId;
    }
    this.updatedAt = Instant.now();
  }

  /** Attaches an order to an already completed task whose order link went missing. */
  public void linkOrder(UUID linkedOrderId) {
    this.orderId = linkedOrderId;
    this.updatedAt = Instant.now();
  }

  /**
   * True when the deadline follows the event date. Manual tasks carry no offset and follow-up tasks
   * are anchored to the completion of their parent.
   */
  public boolean isEventAnchored() {
    return offsetDays != null && parentTaskId == null;
  }

  /**
   * Moves the deadline to {@code newEventDate + offset}. Only pending, event-anchored tasks move.
   *
   * @return true if the task was updated
   */
  public boolean recalculateDeadline(LocalDate newEventDate) {
    if (status != TaskStatus.PENDING || !isEventAnchored()) {
      return false;
    }
    this.deadline = newEventDate.plusDays(offsetDays);
    this.updatedAt = Instant.now();
    return true;
  }

  private void requireTransition(TaskStatus target, String action) {
    if (!this.status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid task state", "Cannot " + action + " task in status " + this.status);
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getEventId() {
    return eventId;
  }

  public String getTemplateId() {
    return templateId;
  }

  public TaskCategory getCategory() {
    return category;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public CompletionKind getCompletionKind() {
    return completionKind;
  }

  public Integer getOffsetDays() {
    return offsetDays;
  }

  public LocalDate getDeadline() {
    return deadline;
  }

  public TaskStatus getStatus() {
    return status;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public String getCompletedBy() {
    return completedBy;
  }

  public Map<String, Object> getCompletionData() {
    return completionData;
  }

  public UUID getOrderId() {
    return orderId;
  }

  public UUID getParentTaskId() {
    return parentTaskId;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
