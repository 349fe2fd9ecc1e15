package io.b2mash.eventops.task;

import java.util.UUID;

/** Outcome of a completion: the updated task plus the ids of anything the cascade created. */
public record TaskCompletionResult(Task task, UUID orderId, UUID followUpTaskId) {}
