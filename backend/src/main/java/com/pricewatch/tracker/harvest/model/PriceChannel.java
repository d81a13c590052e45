package com.pricewatch.tracker.harvest.model;

public enum PriceChannel {
    NORMAL,
    DISCOUNT,
    CLUBCARD
}
