package com.pricewatch.tracker.harvest.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record PriceHistory(
    List<PricePeriod> normal,
    List<PricePeriod> discount,
    List<PricePeriod> clubcard
) {
    public PriceHistory {
        normal = freeze(normal);
        discount = freeze(discount);
        clubcard = freeze(clubcard);
    }

    public static PriceHistory empty() {
        return new PriceHistory(List.of(), List.of(), List.of());
    }

    public List<PricePeriod> channel(PriceChannel channel) {
        switch (channel) {
            case NORMAL:
                return normal;
            case DISCOUNT:
                return discount;
            case CLUBCARD:
                return clubcard;
            default:
                throw new IllegalArgumentException("Unknown channel " + channel);
        }
    }

    public PriceHistory withChannel(PriceChannel channel, List<PricePeriod> periods) {
        switch (channel) {
            case NORMAL:
                return new PriceHistory(periods, discount, clubcard);
            case DISCOUNT:
                return new PriceHistory(normal, periods, clubcard);
            case CLUBCARD:
                return new PriceHistory(normal, discount, periods);
            default:
                throw new IllegalArgumentException("Unknown channel " + channel);
        }
    }

    public PricePeriod latest(PriceChannel channel) {
        List<PricePeriod> periods = channel(channel);
        return periods.isEmpty() ? null : periods.get(periods.size() - 1);
    }

    private static List<PricePeriod> freeze(List<PricePeriod> periods) {
        if (periods == null || periods.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(periods));
    }
}
