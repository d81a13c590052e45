package com.pricewatch.tracker.harvest.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A contiguous span during which one channel's observed price held constant.
 * {@code endedAt} is the last time the price was confirmed; null means the
 * period was opened and not yet confirmed again.
 */
public record PricePeriod(
    BigDecimal price,
    Instant startedAt,
    Instant endedAt,
    BigDecimal unitPrice,
    String unitMeasure,
    String promotionId,
    String promotionDescription,
    String promotionStart,
    String promotionEnd
) {
    public static PricePeriod open(BigDecimal price, Instant at, ObservationMeta meta) {
        ObservationMeta safeMeta = meta == null ? ObservationMeta.none() : meta;
        return new PricePeriod(
            price,
            at,
            at,
            safeMeta.unitPrice(),
            safeMeta.unitMeasure(),
            safeMeta.promotionId(),
            safeMeta.promotionDescription(),
            safeMeta.promotionStart(),
            safeMeta.promotionEnd()
        );
    }

    public PricePeriod withEndedAt(Instant newEndedAt) {
        return new PricePeriod(
            price,
            startedAt,
            newEndedAt,
            unitPrice,
            unitMeasure,
            promotionId,
            promotionDescription,
            promotionStart,
            promotionEnd
        );
    }

    public Instant lastSeenAt() {
        return endedAt != null ? endedAt : startedAt;
    }

    public boolean hasSamePrice(BigDecimal other) {
        if (price == null || other == null) {
            return price == null && other == null;
        }
        return price.compareTo(other) == 0;
    }
}
