package com.pricewatch.tracker.harvest.model;

import java.util.List;

public record ProductSnapshot(
    String identifier,
    String title,
    String defaultImageUrl,
    String packSizeValue,
    String packSizeUnit,
    PriceInfo price,
    List<PromotionInfo> promotions
) {
    public ProductSnapshot {
        promotions = promotions == null ? List.of() : List.copyOf(promotions);
    }
}
