package com.pricewatch.tracker.harvest.model;

import java.math.BigDecimal;
import java.util.List;

public record PromotionInfo(
    String id,
    String description,
    String startDate,
    String endDate,
    List<String> attributes,
    BigDecimal afterDiscount
) {
    public PromotionInfo {
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public boolean hasAttribute(String attribute) {
        return attribute != null && attributes.contains(attribute);
    }
}
