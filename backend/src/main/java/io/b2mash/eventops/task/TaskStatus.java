package io.b2mash.eventops.task;

import java.util.Map;
import java.util.Set;

/** Task lifecycle status. Completion is final. */
public enum TaskStatus {
  PENDING,
  COMPLETED;

  private static final Map<TaskStatus, Set<TaskStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          PENDING, Set.of(COMPLETED),
          COMPLETED, Set.of());

  public Set<TaskStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(TaskStatus target) {
    return allowedTransitions().contains(target);
  }
}
