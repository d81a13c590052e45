package com.pricewatch.tracker.harvest.model;

public record HarvestStatusResponse(
    boolean running,
    HarvestPassStatus phase,
    boolean stopRequested,
    RunState today
) {
}
