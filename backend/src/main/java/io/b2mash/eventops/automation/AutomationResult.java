package io.b2mash.eventops.automation;

import java.time.Instant;
import java.util.List;

/** Summary of one automation tick. */
public record AutomationResult(
    Instant processedAt,
    int templatesProcessed,
    int sent,
    int failed,
    int skipped,
    List<SendDetail> details,
    List<String> errors) {}
