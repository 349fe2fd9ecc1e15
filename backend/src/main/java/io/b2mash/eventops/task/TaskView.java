package io.b2mash.eventops.task;

import java.time.LocalDate;

/** A task with the event context the staff task list shows. */
public record TaskView(
    Task task, String schoolName, LocalDate eventDate, long daysUntilDeadline, boolean overdue) {}
