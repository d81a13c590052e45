package com.pricewatch.tracker.harvest.model;

import java.math.BigDecimal;

public record ObservationMeta(
    BigDecimal unitPrice,
    String unitMeasure,
    String promotionId,
    String promotionDescription,
    String promotionStart,
    String promotionEnd
) {
    public static ObservationMeta none() {
        return new ObservationMeta(null, null, null, null, null, null);
    }

    public static ObservationMeta forUnit(BigDecimal unitPrice, String unitMeasure) {
        return new ObservationMeta(unitPrice, unitMeasure, null, null, null, null);
    }

    public static ObservationMeta forPromotion(PromotionInfo promotion) {
        return new ObservationMeta(
            null,
            null,
            promotion.id(),
            promotion.description(),
            promotion.startDate(),
            promotion.endDate()
        );
    }
}
