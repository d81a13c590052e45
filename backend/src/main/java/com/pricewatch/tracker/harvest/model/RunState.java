package com.pricewatch.tracker.harvest.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

public record RunState(
    LocalDate runDate,
    String runId,
    Instant startedAt,
    int totalItems,
    Set<String> processed,
    Map<String, Integer> errors,
    boolean completed,
    Instant finishedAt
) {
    public RunState {
        processed = processed == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(processed));
        errors = errors == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static RunState fresh(LocalDate runDate, String runId, Instant startedAt) {
        return new RunState(runDate, runId, startedAt, 0, Set.of(), Map.of(), false, null);
    }

    public int processedCount() {
        return processed.size();
    }

    public int errorCount(String identifier) {
        return errors.getOrDefault(identifier, 0);
    }
}
