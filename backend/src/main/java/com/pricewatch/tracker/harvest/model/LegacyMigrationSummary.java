package com.pricewatch.tracker.harvest.model;

public record LegacyMigrationSummary(
    int filesRead,
    int migrated,
    int skippedExisting,
    int failed
) {
}
