package com.pricewatch.tracker.harvest.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

public record HarvestPassRequest(
    List<String> items,
    boolean force,
    Integer workerCount
) {
    public static HarvestPassRequest discoverAll() {
        return new HarvestPassRequest(List.of(), false, null);
    }

    public List<String> normalizedItems() {
        if (items == null) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String item : items) {
            if (item == null) {
                continue;
            }
            String normalized = item.trim();
            if (!normalized.isEmpty()) {
                out.add(normalized);
            }
        }
        return new ArrayList<>(out);
    }

    public boolean hasExplicitItems() {
        return !normalizedItems().isEmpty();
    }
}
