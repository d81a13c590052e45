package com.pricewatch.tracker.harvest.history;

import com.pricewatch.tracker.config.HarvesterProperties;
import com.pricewatch.tracker.harvest.model.ChannelObservation;
import com.pricewatch.tracker.harvest.model.FetchMode;
import com.pricewatch.tracker.harvest.model.ObservationMeta;
import com.pricewatch.tracker.harvest.model.PriceChannel;
import com.pricewatch.tracker.harvest.model.PriceHistory;
import com.pricewatch.tracker.harvest.model.ProductRecord;
import com.pricewatch.tracker.harvest.model.ProductSnapshot;
import com.pricewatch.tracker.harvest.persistence.ProductRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Per-item price history on top of {@link ProductRecordRepository}.
 * <p>
 * Every read-modify-write for one identifier runs under that identifier's
 * stripe lock, so concurrent workers never lose each other's channel updates.
 */
@Service
public class PeriodStore {
    private static final Logger log = LoggerFactory.getLogger(PeriodStore.class);
    private static final int LOCK_STRIPES = 64;

    private final ProductRecordRepository repository;
    private final Clock clock;
    private final PeriodCoalescer coalescer;
    private final PromotionChannelResolver channelResolver;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public PeriodStore(ProductRecordRepository repository, Clock clock, HarvesterProperties properties) {
        this.repository = repository;
        this.clock = clock;
        this.coalescer = new PeriodCoalescer(clock.getZone());
        this.channelResolver = new PromotionChannelResolver(
            properties.getCatalog().getLoyaltyAttribute(),
            properties.getCatalog().getCurrencySuffix()
        );
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    public ProductRecord load(String identifier) {
        return repository.find(identifier);
    }

    public void save(ProductRecord record) {
        repository.save(record);
    }

    public boolean exists(String identifier) {
        return repository.exists(identifier);
    }

    public ProductRecord upsertStatic(
        String identifier,
        String name,
        String unitOfMeasure,
        String defaultImageUrl,
        String packSizeValue,
        String packSizeUnit
    ) {
        synchronized (lockFor(identifier)) {
            ProductRecord record = loadOrCreate(identifier)
                .withStatic(name, unitOfMeasure, defaultImageUrl, packSizeValue, packSizeUnit, clock.instant());
            repository.save(record);
            return record;
        }
    }

    public boolean recordObservation(String identifier, PriceChannel channel, BigDecimal price, ObservationMeta meta) {
        synchronized (lockFor(identifier)) {
            ProductRecord record = loadOrCreate(identifier);
            PeriodCoalescer.Outcome outcome = coalescer.apply(
                record.history().channel(channel),
                price,
                meta,
                clock.instant()
            );
            repository.save(record.withHistory(record.history().withChannel(channel, outcome.periods())));
            return outcome.opened();
        }
    }

    public boolean hasPriceToday(String identifier) {
        ProductRecord record = repository.find(identifier);
        if (record == null) {
            return false;
        }
        LocalDate today = LocalDate.now(clock);
        for (PriceChannel channel : PriceChannel.values()) {
            if (coalescer.touchesDate(record.history().latest(channel), today)) {
                return true;
            }
        }
        return false;
    }

    public void touchLastChecked(String identifier) {
        synchronized (lockFor(identifier)) {
            ProductRecord record = repository.find(identifier);
            if (record == null) {
                return;
            }
            repository.save(record.withLastPriceCheck(clock.instant()));
        }
    }

    public int applyFetch(String identifier, ProductSnapshot snapshot, FetchMode mode) {
        Instant now = clock.instant();
        synchronized (lockFor(identifier)) {
            ProductRecord record = loadOrCreate(identifier);
            if (mode == FetchMode.FULL) {
                String unitOfMeasure = snapshot.price() == null ? null : snapshot.price().unitOfMeasure();
                record = record.withStatic(
                    snapshot.title(),
                    unitOfMeasure,
                    snapshot.defaultImageUrl(),
                    snapshot.packSizeValue(),
                    snapshot.packSizeUnit(),
                    now
                );
            }
            PriceHistory history = record.history();
            int opened = 0;
            for (ChannelObservation observation : channelResolver.resolve(snapshot)) {
                PeriodCoalescer.Outcome outcome = coalescer.apply(
                    history.channel(observation.channel()),
                    observation.price(),
                    observation.meta(),
                    now
                );
                history = history.withChannel(observation.channel(), outcome.periods());
                if (outcome.opened()) {
                    opened++;
                    log.debug("{} {} price now {}", identifier, observation.channel(), observation.price());
                }
            }
            repository.save(record.withHistory(history).withLastPriceCheck(now));
            return opened;
        }
    }

    public boolean isFresh(ProductRecord record, int windowHours) {
        if (record == null || record.lastPriceCheck() == null) {
            return false;
        }
        Instant cutoff = clock.instant().minusSeconds(windowHours * 3600L);
        return record.lastPriceCheck().isAfter(cutoff);
    }

    private ProductRecord loadOrCreate(String identifier) {
        ProductRecord existing = repository.find(identifier);
        return existing != null ? existing : ProductRecord.newRecord(identifier);
    }

    private Object lockFor(String identifier) {
        return locks[Math.floorMod(identifier.hashCode(), LOCK_STRIPES)];
    }
}
