package io.b2mash.eventops.task;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, UUID> {

  List<Task> findByEventIdOrderByDeadlineAsc(UUID eventId);

  List<Task> findByEventIdAndStatus(UUID eventId, TaskStatus status);

  Optional<Task> findFirstByParentTaskIdOrderByCreatedAtAsc(UUID parentTaskId);

  Optional<Task> findFirstByEventIdAndTemplateIdAndStatus(
      UUID eventId, String templateId, TaskStatus status);

  List<Task> findByEventIdInAndTemplateIdAndStatus(
      Collection<UUID> eventIds, String templateId, TaskStatus status);

  List<Task> findByEventIdInAndCategoryAndStatus(
      Collection<UUID> eventIds, TaskCategory category, TaskStatus status);

  @Query(
      """
      SELECT t FROM Task t
      WHERE (:status IS NULL OR t.status = :status)
        AND (:category IS NULL OR t.category = :category)
      ORDER BY t.deadline ASC
      """)
  List<Task> findWithFilters(
      @Param("status") TaskStatus status, @Param("category") TaskCategory category);
}
