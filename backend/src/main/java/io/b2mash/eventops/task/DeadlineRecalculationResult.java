package io.b2mash.eventops.task;

import java.util.List;
import java.util.UUID;

public record DeadlineRecalculationResult(int updatedCount, List<UUID> taskIds) {}
