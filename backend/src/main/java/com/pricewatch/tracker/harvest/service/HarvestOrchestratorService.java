package com.pricewatch.tracker.harvest.service;

import com.pricewatch.tracker.config.HarvesterProperties;
import com.pricewatch.tracker.harvest.discovery.CatalogDiscoveryService;
import com.pricewatch.tracker.harvest.fetch.PriceFetchClient;
import com.pricewatch.tracker.harvest.history.PeriodStore;
import com.pricewatch.tracker.harvest.model.CatalogDiscoveryResult;
import com.pricewatch.tracker.harvest.model.FetchMode;
import com.pricewatch.tracker.harvest.model.HarvestPassRequest;
import com.pricewatch.tracker.harvest.model.HarvestPassStatus;
import com.pricewatch.tracker.harvest.model.HarvestPassSummary;
import com.pricewatch.tracker.harvest.model.HarvestStatusResponse;
import com.pricewatch.tracker.harvest.model.ItemOutcome;
import com.pricewatch.tracker.harvest.model.ProductFetchResult;
import com.pricewatch.tracker.harvest.model.ProductRecord;
import com.pricewatch.tracker.harvest.model.RunState;
import com.pricewatch.tracker.harvest.persistence.RecordPersistenceException;
import com.pricewatch.tracker.harvest.run.RunStateTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one harvest pass: resolve the item population, skip what today's run
 * already covered, fetch the rest on a bounded worker pool and mark the day
 * complete once every item is processed.
 * <p>
 * Only one pass runs at a time, and a new pass waits until workers left over
 * from a drained pass have exited. {@link #requestStop()} stops dispatching,
 * lets in-flight items finish and leaves the day resumable.
 */
@Service
public class HarvestOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(HarvestOrchestratorService.class);

    private final CatalogDiscoveryService discoveryService;
    private final PriceFetchClient fetchClient;
    private final PeriodStore periodStore;
    private final RunStateTracker runStateTracker;
    private final HarvesterProperties properties;
    private final ExecutorService harvestRunExecutor;
    private final Clock clock;
    private final AtomicBoolean active = new AtomicBoolean(false);

    private volatile AtomicBoolean stopToken = new AtomicBoolean(false);
    private volatile HarvestPassStatus phase = HarvestPassStatus.NOT_STARTED;
    private volatile ExecutorService drainingPool;

    public HarvestOrchestratorService(
        CatalogDiscoveryService discoveryService,
        PriceFetchClient fetchClient,
        PeriodStore periodStore,
        RunStateTracker runStateTracker,
        HarvesterProperties properties,
        @Qualifier("harvestRunExecutor") ExecutorService harvestRunExecutor,
        Clock clock
    ) {
        this.discoveryService = discoveryService;
        this.fetchClient = fetchClient;
        this.periodStore = periodStore;
        this.runStateTracker = runStateTracker;
        this.properties = properties;
        this.harvestRunExecutor = harvestRunExecutor;
        this.clock = clock;
    }

    public HarvestPassSummary runPass(HarvestPassRequest request) {
        acquire();
        try {
            return execute(request);
        } finally {
            active.set(false);
        }
    }

    public LocalDate startAsync(HarvestPassRequest request) {
        acquire();
        try {
            harvestRunExecutor.submit(() -> {
                try {
                    execute(request);
                } catch (Exception e) {
                    log.error("Harvest pass failed", e);
                } finally {
                    active.set(false);
                }
            });
        } catch (RuntimeException e) {
            active.set(false);
            throw e;
        }
        return LocalDate.now(clock);
    }

    public boolean requestStop() {
        if (!active.get()) {
            return stillDraining();
        }
        stopToken.set(true);
        log.info("Stop requested; no further items will be dispatched");
        return true;
    }

    public boolean isRunning() {
        return active.get() || stillDraining();
    }

    public HarvestStatusResponse status() {
        RunState today;
        try {
            today = runStateTracker.today();
        } catch (RecordPersistenceException e) {
            log.warn("Failed to load today's run state", e);
            today = null;
        }
        return new HarvestStatusResponse(isRunning(), phase, stopToken.get(), today);
    }

    private void acquire() {
        if (!active.compareAndSet(false, true)) {
            throw new ActiveHarvestException("A harvest pass is already running (phase=" + phase + ")");
        }
        if (stillDraining()) {
            active.set(false);
            throw new ActiveHarvestException("Workers from the previous harvest pass are still draining");
        }
        drainingPool = null;
        stopToken = new AtomicBoolean(false);
    }

    private boolean stillDraining() {
        ExecutorService pool = drainingPool;
        return pool != null && !pool.isTerminated();
    }

    private HarvestPassSummary execute(HarvestPassRequest request) {
        Instant startedAt = clock.instant();
        boolean force = request.force();
        AtomicBoolean stopRequested = stopToken;
        phase = HarvestPassStatus.NOT_STARTED;

        RunState state = runStateTracker.ensureToday(force);
        if (state.completed() && !force) {
            log.info("Run {} for {} already completed; nothing to do", state.runId(), state.runDate());
            phase = HarvestPassStatus.ALREADY_COMPLETED;
            return summary(state, HarvestPassStatus.ALREADY_COMPLETED, 0, 0, 0, 0, new EnumMap<>(ItemOutcome.class), startedAt);
        }

        phase = HarvestPassStatus.DISCOVERING;
        List<String> population = resolvePopulation(request);
        runStateTracker.recordPopulation(population.size());
        if (population.isEmpty()) {
            log.warn("No items to harvest for {}", state.runDate());
            phase = HarvestPassStatus.NO_ITEMS;
            return summary(
                runStateTracker.snapshot(),
                HarvestPassStatus.NO_ITEMS,
                0,
                0,
                0,
                0,
                new EnumMap<>(ItemOutcome.class),
                startedAt
            );
        }

        Set<String> processed = runStateTracker.snapshot().processed();
        int alreadyProcessed = 0;
        int foldedToday = 0;
        List<String> remaining = new ArrayList<>();
        for (String identifier : population) {
            if (processed.contains(identifier)) {
                alreadyProcessed++;
                continue;
            }
            if (!force && hasPriceToday(identifier)) {
                if (runStateTracker.markProcessed(identifier)) {
                    foldedToday++;
                    continue;
                }
            }
            remaining.add(identifier);
        }
        log.info(
            "Harvest {}: population={} alreadyProcessed={} pricedToday={} remaining={}",
            state.runDate(),
            population.size(),
            alreadyProcessed,
            foldedToday,
            remaining.size()
        );

        phase = HarvestPassStatus.DISPATCHING;
        Map<ItemOutcome, AtomicInteger> outcomes = new EnumMap<>(ItemOutcome.class);
        for (ItemOutcome outcome : ItemOutcome.values()) {
            outcomes.put(outcome, new AtomicInteger());
        }
        int dispatched = dispatch(remaining, request, force, outcomes, stopRequested);

        RunState finalState = runStateTracker.snapshot();
        HarvestPassStatus status;
        if (finalState.processed().containsAll(population) && runStateTracker.markCompleted()) {
            status = HarvestPassStatus.COMPLETED;
        } else if (stopRequested.get()) {
            status = HarvestPassStatus.DRAINING;
        } else {
            status = HarvestPassStatus.PARTIAL_SAVED;
        }
        phase = status;
        Map<ItemOutcome, Integer> counts = new EnumMap<>(ItemOutcome.class);
        outcomes.forEach((outcome, count) -> counts.put(outcome, count.get()));
        HarvestPassSummary summary = summary(
            runStateTracker.snapshot(),
            status,
            population.size(),
            alreadyProcessed,
            foldedToday,
            dispatched,
            counts,
            startedAt
        );
        log.info(
            "Harvest {} finished with status {}: fetched={} fresh={} failed={} processed={}/{}",
            summary.runDate(),
            status,
            summary.fetched(),
            summary.skippedFresh(),
            summary.failed(),
            runStateTracker.snapshot().processedCount(),
            population.size()
        );
        return summary;
    }

    private List<String> resolvePopulation(HarvestPassRequest request) {
        if (request.hasExplicitItems()) {
            return request.normalizedItems();
        }
        CatalogDiscoveryResult discovery = discoveryService.discoverCatalog();
        if (!discovery.errors().isEmpty()) {
            log.warn("Catalog discovery errors: {}", discovery.errors());
        }
        return new ArrayList<>(discovery.identifiers());
    }

    private boolean hasPriceToday(String identifier) {
        try {
            return periodStore.hasPriceToday(identifier);
        } catch (RecordPersistenceException e) {
            log.warn("Could not read record {}; it will be fetched", identifier, e);
            return false;
        }
    }

    private int dispatch(
        List<String> remaining,
        HarvestPassRequest request,
        boolean force,
        Map<ItemOutcome, AtomicInteger> outcomes,
        AtomicBoolean stopRequested
    ) {
        if (remaining.isEmpty()) {
            return 0;
        }
        int workers = request.workerCount() == null
            ? properties.getWorkerCount()
            : Math.max(1, request.workerCount());
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("harvest-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        int total = remaining.size();
        int dispatched = 0;
        try {
            for (int i = 0; i < total; i++) {
                if (stopRequested.get()) {
                    log.info("Stop requested after dispatching {}/{} items", dispatched, total);
                    break;
                }
                String identifier = remaining.get(i);
                int position = i + 1;
                pool.submit(() -> {
                    ItemOutcome outcome = processItem(identifier, position, total, force, stopRequested);
                    outcomes.get(outcome).incrementAndGet();
                });
                dispatched++;
            }
        } finally {
            pool.shutdown();
        }
        awaitWorkers(pool, stopRequested);
        return dispatched;
    }

    private void awaitWorkers(ExecutorService pool, AtomicBoolean stopRequested) {
        try {
            while (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
                if (stopRequested.get()) {
                    phase = HarvestPassStatus.DRAINING;
                    int grace = properties.getDrainGraceSeconds();
                    if (!pool.awaitTermination(grace, TimeUnit.SECONDS)) {
                        log.warn("Workers still busy {}s after stop; new passes wait until they exit", grace);
                        drainingPool = pool;
                    }
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested.set(true);
            drainingPool = pool;
            log.warn("Interrupted while waiting for workers; treating as stop");
        }
    }

    ItemOutcome processItem(String identifier, int position, int total, boolean force, AtomicBoolean stopRequested) {
        if (stopRequested.get()) {
            return ItemOutcome.CANCELLED;
        }
        String progress = "[" + position + "/" + total + "]";
        try {
            ProductRecord existing = periodStore.load(identifier);
            if (!force && periodStore.isFresh(existing, properties.getFreshnessWindowHours())) {
                log.info("{} {} checked within {}h; skipping", progress, identifier, properties.getFreshnessWindowHours());
                runStateTracker.markProcessed(identifier);
                return ItemOutcome.SKIPPED_FRESH;
            }

            FetchMode mode = existing != null ? FetchMode.PRICE_ONLY : FetchMode.FULL;
            ProductFetchResult result = fetchClient.fetch(identifier, mode);
            if (!result.isSuccess()) {
                log.warn("{} {} {} failed: {} {}", progress, identifier, mode, result.errorCode(), result.errorMessage());
                runStateTracker.recordError(identifier);
                return result.status() == ProductFetchResult.Status.NO_DATA
                    ? ItemOutcome.NO_DATA
                    : ItemOutcome.FETCH_FAILED;
            }

            int opened = periodStore.applyFetch(identifier, result.product(), mode);
            runStateTracker.markProcessed(identifier);
            log.info("{} {} {} ok; {} new period(s)", progress, identifier, mode, opened);
            return ItemOutcome.FETCHED;
        } catch (RecordPersistenceException e) {
            log.error("{} {} could not be saved", progress, identifier, e);
            runStateTracker.recordError(identifier);
            return ItemOutcome.PERSISTENCE_FAILED;
        } catch (RuntimeException e) {
            log.error("{} {} failed unexpectedly", progress, identifier, e);
            runStateTracker.recordError(identifier);
            return ItemOutcome.FETCH_FAILED;
        }
    }

    private HarvestPassSummary summary(
        RunState state,
        HarvestPassStatus status,
        int populationSize,
        int alreadyProcessed,
        int foldedToday,
        int dispatched,
        Map<ItemOutcome, Integer> counts,
        Instant startedAt
    ) {
        int failed = 0;
        for (Map.Entry<ItemOutcome, Integer> entry : counts.entrySet()) {
            if (entry.getKey().isError()) {
                failed += entry.getValue();
            }
        }
        return new HarvestPassSummary(
            state.runId(),
            state.runDate(),
            status,
            populationSize,
            alreadyProcessed,
            foldedToday,
            dispatched,
            counts.getOrDefault(ItemOutcome.FETCHED, 0),
            counts.getOrDefault(ItemOutcome.SKIPPED_FRESH, 0),
            failed,
            startedAt,
            clock.instant()
        );
    }
}
