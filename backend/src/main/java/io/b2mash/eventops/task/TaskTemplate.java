package io.b2mash.eventops.task;

/**
 * Blueprint for one generated task.
 *
 * @param id stable template id, stored on every task created from it
 * @param offsetDays signed day offset from the event date to the task deadline
 * @param createsOrder completing the task creates an aggregate supplier order
 * @param createsFollowUp completing the task spawns a shipping task linked to that order
 */
public record TaskTemplate(
    String id,
    TaskCategory category,
    String name,
    String description,
    CompletionKind completionKind,
    int offsetDays,
    boolean createsOrder,
    boolean createsFollowUp) {}
