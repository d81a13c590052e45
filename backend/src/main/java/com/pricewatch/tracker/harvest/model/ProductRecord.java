package com.pricewatch.tracker.harvest.model;

import java.time.Instant;

public record ProductRecord(
    int schemaVersion,
    String identifier,
    String name,
    String unitOfMeasure,
    String defaultImageUrl,
    String packSizeValue,
    String packSizeUnit,
    Instant lastStaticRefresh,
    Instant lastPriceCheck,
    PriceHistory history
) {
    public static final int CURRENT_SCHEMA_VERSION = 2;

    public ProductRecord {
        history = history == null ? PriceHistory.empty() : history;
        if (schemaVersion <= 0) {
            schemaVersion = CURRENT_SCHEMA_VERSION;
        }
    }

    public static ProductRecord newRecord(String identifier) {
        return new ProductRecord(
            CURRENT_SCHEMA_VERSION,
            identifier,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            PriceHistory.empty()
        );
    }

    public ProductRecord withStatic(
        String newName,
        String newUnitOfMeasure,
        String newDefaultImageUrl,
        String newPackSizeValue,
        String newPackSizeUnit,
        Instant refreshedAt
    ) {
        return new ProductRecord(
            CURRENT_SCHEMA_VERSION,
            identifier,
            newName,
            newUnitOfMeasure,
            newDefaultImageUrl,
            newPackSizeValue,
            newPackSizeUnit,
            refreshedAt,
            lastPriceCheck == null ? refreshedAt : lastPriceCheck,
            history
        );
    }

    public ProductRecord withLastPriceCheck(Instant checkedAt) {
        return new ProductRecord(
            CURRENT_SCHEMA_VERSION,
            identifier,
            name,
            unitOfMeasure,
            defaultImageUrl,
            packSizeValue,
            packSizeUnit,
            lastStaticRefresh,
            checkedAt,
            history
        );
    }

    public ProductRecord withHistory(PriceHistory newHistory) {
        return new ProductRecord(
            CURRENT_SCHEMA_VERSION,
            identifier,
            name,
            unitOfMeasure,
            defaultImageUrl,
            packSizeValue,
            packSizeUnit,
            lastStaticRefresh,
            lastPriceCheck,
            newHistory
        );
    }
}
