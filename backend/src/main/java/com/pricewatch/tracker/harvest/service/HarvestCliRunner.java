package com.pricewatch.tracker.harvest.service;

import com.pricewatch.tracker.config.HarvesterProperties;
import com.pricewatch.tracker.harvest.history.LegacyHistoryMigrator;
import com.pricewatch.tracker.harvest.model.HarvestPassRequest;
import com.pricewatch.tracker.harvest.model.HarvestPassSummary;
import com.pricewatch.tracker.harvest.model.LegacyMigrationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

@Component
public class HarvestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(HarvestCliRunner.class);

    private final HarvesterProperties properties;
    private final HarvestOrchestratorService orchestratorService;
    private final LegacyHistoryMigrator legacyHistoryMigrator;
    private final ConfigurableApplicationContext applicationContext;

    public HarvestCliRunner(
        HarvesterProperties properties,
        HarvestOrchestratorService orchestratorService,
        LegacyHistoryMigrator legacyHistoryMigrator,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.legacyHistoryMigrator = legacyHistoryMigrator;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        HarvesterProperties.Cli cli = properties.getCli();
        String legacyDir = cli.getLegacyImportDir();
        boolean importLegacy = legacyDir != null && !legacyDir.isBlank();
        if (!cli.isRun() && !importLegacy) {
            return;
        }

        if (importLegacy) {
            LegacyMigrationSummary migration = legacyHistoryMigrator.migrateDirectory(Path.of(legacyDir.trim()));
            log.info("Legacy import finished: migrated={} skipped={} failed={}",
                migration.migrated(), migration.skippedExisting(), migration.failed());
        }

        if (cli.isRun()) {
            HarvestPassRequest request = new HarvestPassRequest(
                parseItems(cli.getItems()),
                cli.isForce(),
                cli.getWorkers() > 0 ? cli.getWorkers() : null
            );
            HarvestPassSummary summary = orchestratorService.runPass(request);
            log.info(
                "Harvest {} ({}) finished with status {}: population={} dispatched={} fetched={} fresh={} failed={}",
                summary.runDate(),
                summary.runId(),
                summary.status(),
                summary.populationSize(),
                summary.dispatched(),
                summary.fetched(),
                summary.skippedFresh(),
                summary.failed()
            );
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    static List<String> parseItems(String items) {
        if (items == null || items.isBlank()) {
            return List.of();
        }
        return Arrays.stream(items.split(","))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .collect(Collectors.toList());
    }
}
