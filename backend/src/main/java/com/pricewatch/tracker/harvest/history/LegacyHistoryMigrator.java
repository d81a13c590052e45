package com.pricewatch.tracker.harvest.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricewatch.tracker.harvest.model.LegacyMigrationSummary;
import com.pricewatch.tracker.harvest.model.LegacyPriceEntry;
import com.pricewatch.tracker.harvest.model.LegacyProductDocument;
import com.pricewatch.tracker.harvest.model.ObservationMeta;
import com.pricewatch.tracker.harvest.model.PriceHistory;
import com.pricewatch.tracker.harvest.model.PricePeriod;
import com.pricewatch.tracker.harvest.model.ProductRecord;
import com.pricewatch.tracker.harvest.persistence.RecordPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * One-time import of the flat, append-on-change history files into the
 * per-channel period model. Identifiers that already have a record are left
 * untouched.
 * <p>
 * Each legacy entry marks the moment something changed, so a period runs from
 * the entry that introduced its price to the next entry that changed it. The
 * final period ends at the file's last price check.
 */
@Service
public class LegacyHistoryMigrator {
    private static final Logger log = LoggerFactory.getLogger(LegacyHistoryMigrator.class);

    private final PeriodStore periodStore;
    private final ObjectMapper objectMapper;
    private final ZoneId zone;

    public LegacyHistoryMigrator(PeriodStore periodStore, ObjectMapper objectMapper, Clock clock) {
        this.periodStore = periodStore;
        this.objectMapper = objectMapper;
        this.zone = clock.getZone();
    }

    public LegacyMigrationSummary migrateDirectory(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Legacy history directory not found: " + directory);
        }
        int filesRead = 0;
        int migrated = 0;
        int skipped = 0;
        int failed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                filesRead++;
                try {
                    LegacyProductDocument document = objectMapper.readValue(file.toFile(), LegacyProductDocument.class);
                    String identifier = identifierFor(document, file);
                    if (periodStore.exists(identifier)) {
                        skipped++;
                        continue;
                    }
                    periodStore.save(convert(identifier, document));
                    migrated++;
                } catch (IOException | RecordPersistenceException e) {
                    failed++;
                    log.warn("Failed to migrate legacy history file {}", file, e);
                }
            }
        }
        log.info(
            "Legacy migration from {}: files={} migrated={} skippedExisting={} failed={}",
            directory,
            filesRead,
            migrated,
            skipped,
            failed
        );
        return new LegacyMigrationSummary(filesRead, migrated, skipped, failed);
    }

    ProductRecord convert(String identifier, LegacyProductDocument document) {
        Instant lastPriceCheck = parseTimestamp(document.lastScrapedPrice());
        List<LegacyPriceEntry> entries = document.priceHistory();
        List<PricePeriod> normal = fold(
            entries,
            LegacyPriceEntry::priceActual,
            entry -> ObservationMeta.forUnit(entry.unitPrice(), entry.unitMeasure()),
            lastPriceCheck
        );
        List<PricePeriod> clubcard = fold(
            entries,
            LegacyPriceEntry::clubcardPrice,
            entry -> new ObservationMeta(
                null,
                null,
                entry.promotionId(),
                entry.promotionDescription(),
                entry.promotionStart(),
                entry.promotionEnd()
            ),
            lastPriceCheck
        );
        return new ProductRecord(
            ProductRecord.CURRENT_SCHEMA_VERSION,
            identifier,
            document.name(),
            document.unitOfMeasure(),
            document.defaultImageUrl(),
            document.packSizeValue(),
            document.packSizeUnit(),
            parseTimestamp(document.lastScrapedStatic()),
            lastPriceCheck,
            new PriceHistory(normal, List.of(), clubcard)
        );
    }

    private List<PricePeriod> fold(
        List<LegacyPriceEntry> entries,
        Function<LegacyPriceEntry, BigDecimal> priceOf,
        Function<LegacyPriceEntry, ObservationMeta> metaOf,
        Instant lastCheck
    ) {
        List<PricePeriod> periods = new ArrayList<>();
        PricePeriod open = null;
        for (LegacyPriceEntry entry : entries) {
            Instant at = parseTimestamp(entry.timestamp());
            if (at == null) {
                continue;
            }
            BigDecimal price = priceOf.apply(entry);
            if (open != null && open.hasSamePrice(price)) {
                continue;
            }
            if (open != null) {
                periods.add(open.withEndedAt(at));
                open = null;
            }
            if (price != null) {
                open = PricePeriod.open(price, at, metaOf.apply(entry));
            }
        }
        if (open != null) {
            Instant end = lastCheck != null && lastCheck.isAfter(open.startedAt()) ? lastCheck : open.startedAt();
            periods.add(open.withEndedAt(end));
        }
        return periods;
    }

    private Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                trimmed,
                OffsetDateTime::from,
                LocalDateTime::from
            );
            if (parsed instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            return ((LocalDateTime) parsed).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable legacy timestamp {}", trimmed);
            return null;
        }
    }

    private static String identifierFor(LegacyProductDocument document, Path file) {
        if (document.identifier() != null && !document.identifier().isBlank()) {
            return document.identifier().trim();
        }
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - ".json".length());
    }
}
