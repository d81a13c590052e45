package com.pricewatch.tracker.harvest.api;

import java.util.List;

public record HarvestApiRunRequest(
    List<String> items,
    Boolean force,
    Integer workers
) {
}
