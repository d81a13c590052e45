package com.pricewatch.tracker.harvest.history;

import com.pricewatch.tracker.harvest.model.ObservationMeta;
import com.pricewatch.tracker.harvest.model.PricePeriod;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies one price observation to a channel's period list.
 * <p>
 * The last period is extended to {@code now} when the price is unchanged and
 * it was last seen no more than one calendar day ago. Otherwise a new period
 * is appended.
 */
public class PeriodCoalescer {
    private final ZoneId zone;

    public PeriodCoalescer(ZoneId zone) {
        this.zone = zone;
    }

    public Outcome apply(List<PricePeriod> periods, BigDecimal price, ObservationMeta meta, Instant now) {
        List<PricePeriod> updated = new ArrayList<>(periods == null ? List.of() : periods);
        if (updated.isEmpty()) {
            updated.add(PricePeriod.open(price, now, meta));
            return new Outcome(updated, true);
        }

        int lastIndex = updated.size() - 1;
        PricePeriod last = updated.get(lastIndex);
        if (last.hasSamePrice(price) && !isStale(last, now)) {
            Instant lastSeen = last.lastSeenAt();
            Instant extendedTo = lastSeen != null && lastSeen.isAfter(now) ? lastSeen : now;
            updated.set(lastIndex, last.withEndedAt(extendedTo));
            return new Outcome(updated, false);
        }

        updated.add(PricePeriod.open(price, now, meta));
        return new Outcome(updated, true);
    }

    public boolean isStale(PricePeriod period, Instant now) {
        Instant lastSeen = period.lastSeenAt();
        if (lastSeen == null) {
            return true;
        }
        long days = ChronoUnit.DAYS.between(toDate(lastSeen), toDate(now));
        return days > 1;
    }

    public boolean touchesDate(PricePeriod period, LocalDate date) {
        if (period == null) {
            return false;
        }
        return (period.startedAt() != null && toDate(period.startedAt()).equals(date))
            || (period.endedAt() != null && toDate(period.endedAt()).equals(date));
    }

    public LocalDate toDate(Instant instant) {
        return instant.atZone(zone).toLocalDate();
    }

    public record Outcome(List<PricePeriod> periods, boolean opened) {
    }
}
