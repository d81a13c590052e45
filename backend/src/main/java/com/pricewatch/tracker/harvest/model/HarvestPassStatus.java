package com.pricewatch.tracker.harvest.model;

public enum HarvestPassStatus {
    NOT_STARTED,
    DISCOVERING,
    DISPATCHING,
    DRAINING,
    COMPLETED,
    PARTIAL_SAVED,
    ALREADY_COMPLETED,
    NO_ITEMS
}
