package com.pricewatch.tracker.harvest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record LegacyPriceEntry(
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("price_actual") BigDecimal priceActual,
    @JsonProperty("unit_price") BigDecimal unitPrice,
    @JsonProperty("unit_measure") String unitMeasure,
    @JsonProperty("is_promotion") Boolean promotion,
    @JsonProperty("promotion_id") String promotionId,
    @JsonProperty("promotion_description") String promotionDescription,
    @JsonProperty("promotion_start") String promotionStart,
    @JsonProperty("promotion_end") String promotionEnd,
    @JsonProperty("clubcard_price") BigDecimal clubcardPrice
) {
}
