package com.pricewatch.tracker.harvest.model;

public enum ItemOutcome {
    FETCHED,
    SKIPPED_FRESH,
    FETCH_FAILED,
    NO_DATA,
    PERSISTENCE_FAILED,
    CANCELLED;

    public boolean isError() {
        return this == FETCH_FAILED || this == NO_DATA || this == PERSISTENCE_FAILED;
    }
}
