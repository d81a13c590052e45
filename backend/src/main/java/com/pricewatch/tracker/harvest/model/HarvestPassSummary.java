package com.pricewatch.tracker.harvest.model;

import java.time.Instant;
import java.time.LocalDate;

public record HarvestPassSummary(
    String runId,
    LocalDate runDate,
    HarvestPassStatus status,
    int populationSize,
    int alreadyProcessed,
    int foldedToday,
    int dispatched,
    int fetched,
    int skippedFresh,
    int failed,
    Instant startedAt,
    Instant finishedAt
) {
}
