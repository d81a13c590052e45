package com.pricewatch.tracker.harvest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record LegacyProductDocument(
    @JsonProperty("tpnc") String identifier,
    @JsonProperty("name") String name,
    @JsonProperty("unit_of_measure") String unitOfMeasure,
    @JsonProperty("default_image_url") String defaultImageUrl,
    @JsonProperty("pack_size_value") String packSizeValue,
    @JsonProperty("pack_size_unit") String packSizeUnit,
    @JsonProperty("last_scraped_static") String lastScrapedStatic,
    @JsonProperty("last_scraped_price") String lastScrapedPrice,
    @JsonProperty("price_history") List<LegacyPriceEntry> priceHistory
) {
    public LegacyProductDocument {
        priceHistory = priceHistory == null ? List.of() : List.copyOf(priceHistory);
    }
}
