package com.pricewatch.tracker.harvest.service;

import com.pricewatch.tracker.config.HarvesterProperties;
import com.pricewatch.tracker.harvest.model.HarvestPassRequest;
import com.pricewatch.tracker.harvest.model.HarvestPassSummary;
import com.pricewatch.tracker.harvest.run.RunStateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class HarvestScheduler {
    private static final Logger log = LoggerFactory.getLogger(HarvestScheduler.class);

    private final HarvestOrchestratorService orchestratorService;
    private final RunStateTracker runStateTracker;
    private final HarvesterProperties properties;

    public HarvestScheduler(
        HarvestOrchestratorService orchestratorService,
        RunStateTracker runStateTracker,
        HarvesterProperties properties
    ) {
        this.orchestratorService = orchestratorService;
        this.runStateTracker = runStateTracker;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (!properties.getSchedule().isEnabled()) {
            return;
        }
        if (!properties.getSchedule().isRunOnStartup()) {
            log.info("Harvest scheduler ready; cron {}", properties.getSchedule().getCron());
            return;
        }
        try {
            orchestratorService.startAsync(HarvestPassRequest.discoverAll());
            log.info("Startup harvest pass started");
        } catch (ActiveHarvestException e) {
            log.info("Startup harvest skipped: {}", e.getMessage());
        }
    }

    @Scheduled(cron = "${harvester.schedule.cron:0 0 5 * * *}", zone = "${harvester.zone-id:Europe/Budapest}")
    public void scheduledHarvest() {
        if (!properties.getSchedule().isEnabled()) {
            return;
        }
        try {
            if (runStateTracker.isCompletedToday()) {
                log.info("Today's harvest already completed; scheduled run skipped");
                return;
            }
            HarvestPassSummary summary = orchestratorService.runPass(HarvestPassRequest.discoverAll());
            log.info("Scheduled harvest finished with status {}", summary.status());
        } catch (ActiveHarvestException e) {
            log.info("Scheduled harvest skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled harvest failed", e);
        }
    }
}
