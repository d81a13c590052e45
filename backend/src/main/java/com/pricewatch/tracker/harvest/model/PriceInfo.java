package com.pricewatch.tracker.harvest.model;

import java.math.BigDecimal;

public record PriceInfo(
    BigDecimal actual,
    BigDecimal unitPrice,
    String unitOfMeasure
) {
}
