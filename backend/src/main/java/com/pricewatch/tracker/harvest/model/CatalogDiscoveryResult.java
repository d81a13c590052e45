package com.pricewatch.tracker.harvest.model;

import java.util.List;
import java.util.Map;

public record CatalogDiscoveryResult(
    List<String> identifiers,
    int subIndexCount,
    int subIndexesFetched,
    Map<String, Integer> errors
) {
    public static CatalogDiscoveryResult empty(Map<String, Integer> errors) {
        return new CatalogDiscoveryResult(List.of(), 0, 0, errors);
    }
}
