package io.b2mash.eventops.event;

import java.time.LocalDate;

public record RescheduleResult(
    SchoolEvent event,
    LocalDate previousDate,
    int tasksRecalculated,
    boolean recalculationFailed) {}
