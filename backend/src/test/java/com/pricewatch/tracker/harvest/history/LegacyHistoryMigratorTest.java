package com.pricewatch.tracker.harvest.history;

import com.pricewatch.tracker.config.HarvestConfig;
import com.pricewatch.tracker.harvest.model.LegacyMigrationSummary;
import com.pricewatch.tracker.harvest.model.PricePeriod;
import com.pricewatch.tracker.harvest.model.ProductRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LegacyHistoryMigratorTest {
    private static final Path LEGACY_DIR = Path.of("src/test/resources/fixtures/legacy");

    @Mock
    private PeriodStore periodStore;

    private LegacyHistoryMigrator migrator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneId.of("Europe/Budapest"));
        migrator = new LegacyHistoryMigrator(periodStore, HarvestConfig.buildObjectMapper(), clock);
    }

    @Test
    void foldsFlatHistoryIntoChannelPeriods() throws Exception {
        when(periodStore.exists("2004120000009")).thenReturn(false);

        LegacyMigrationSummary summary = migrator.migrateDirectory(LEGACY_DIR);

        ArgumentCaptor<ProductRecord> captor = ArgumentCaptor.forClass(ProductRecord.class);
        verify(periodStore).save(captor.capture());
        ProductRecord record = captor.getValue();
        assertThat(summary.migrated()).isEqualTo(1);
        assertThat(record.schemaVersion()).isEqualTo(ProductRecord.CURRENT_SCHEMA_VERSION);
        assertThat(record.name()).isEqualTo("Trappista sajt 250 g");
        assertThat(record.lastPriceCheck()).isEqualTo(Instant.parse("2024-05-10T03:00:00Z"));

        List<PricePeriod> normal = record.history().normal();
        assertThat(normal).hasSize(2);
        assertThat(normal.get(0).price()).isEqualByComparingTo("1000");
        assertThat(normal.get(0).startedAt()).isEqualTo(Instant.parse("2024-05-01T03:00:00Z"));
        assertThat(normal.get(0).endedAt()).isEqualTo(Instant.parse("2024-05-06T03:00:00Z"));
        assertThat(normal.get(0).unitPrice()).isEqualByComparingTo("4000");
        assertThat(normal.get(1).price()).isEqualByComparingTo("1100");
        assertThat(normal.get(1).endedAt()).isEqualTo(Instant.parse("2024-05-10T03:00:00Z"));

        List<PricePeriod> clubcard = record.history().clubcard();
        assertThat(clubcard).hasSize(1);
        assertThat(clubcard.get(0).price()).isEqualByComparingTo("799");
        assertThat(clubcard.get(0).promotionId()).isEqualTo("cc-77");
        assertThat(clubcard.get(0).startedAt()).isEqualTo(Instant.parse("2024-05-03T03:00:00Z"));
        assertThat(clubcard.get(0).endedAt()).isEqualTo(Instant.parse("2024-05-06T03:00:00Z"));
        assertThat(record.history().discount()).isEmpty();
    }

    @Test
    void existingRecordsAreNotOverwritten() throws Exception {
        when(periodStore.exists("2004120000009")).thenReturn(true);

        LegacyMigrationSummary summary = migrator.migrateDirectory(LEGACY_DIR);

        assertThat(summary.skippedExisting()).isEqualTo(1);
        verify(periodStore, never()).save(any());
    }

    @Test
    void unreadableFileIsCountedAndOthersContinue(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("broken.json"), "{ not json");
        Files.copy(LEGACY_DIR.resolve("2004120000009.json"), dir.resolve("2004120000009.json"));
        when(periodStore.exists("2004120000009")).thenReturn(false);

        LegacyMigrationSummary summary = migrator.migrateDirectory(dir);

        assertThat(summary.filesRead()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.migrated()).isEqualTo(1);
    }

    @Test
    void missingDirectoryIsRejected() {
        assertThrows(IOException.class, () -> migrator.migrateDirectory(Path.of("does-not-exist")));
    }
}
