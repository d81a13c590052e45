package com.pricewatch.tracker.harvest.model;

import java.math.BigDecimal;

public record ChannelObservation(
    PriceChannel channel,
    BigDecimal price,
    ObservationMeta meta
) {
}
