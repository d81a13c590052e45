package com.pricewatch.tracker.harvest.run;

import com.pricewatch.tracker.harvest.model.RunState;
import com.pricewatch.tracker.harvest.persistence.RecordPersistenceException;
import com.pricewatch.tracker.harvest.persistence.RunStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Durable bookkeeping for the current calendar day's pass.
 * <p>
 * Every mutation is persisted before it becomes visible in memory. When the
 * write fails the previous state is kept and the mutation reports false.
 */
@Service
public class RunStateTracker {
    private static final Logger log = LoggerFactory.getLogger(RunStateTracker.class);

    private final RunStateRepository repository;
    private final Clock clock;
    private final Object lock = new Object();

    private RunState current;

    public RunStateTracker(RunStateRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public RunState ensureToday(boolean forceReset) {
        synchronized (lock) {
            LocalDate today = LocalDate.now(clock);
            RunState loaded = null;
            if (!forceReset) {
                loaded = current != null && today.equals(current.runDate()) ? current : repository.find(today);
            }
            if (loaded != null) {
                current = loaded;
                log.info(
                    "Resuming run {} for {}: processed={} completed={}",
                    loaded.runId(),
                    today,
                    loaded.processedCount(),
                    loaded.completed()
                );
                return loaded;
            }
            RunState fresh = RunState.fresh(today, UUID.randomUUID().toString(), clock.instant());
            repository.save(fresh);
            current = fresh;
            log.info("Started run {} for {}{}", fresh.runId(), today, forceReset ? " (forced reset)" : "");
            return fresh;
        }
    }

    public boolean recordPopulation(int total) {
        return mutate(state -> new RunState(
            state.runDate(),
            state.runId(),
            state.startedAt(),
            Math.max(0, total),
            state.processed(),
            state.errors(),
            state.completed(),
            state.finishedAt()
        ));
    }

    public boolean markProcessed(String identifier) {
        synchronized (lock) {
            if (current != null && current.processed().contains(identifier)) {
                return true;
            }
            return mutate(state -> {
                Set<String> processed = new LinkedHashSet<>(state.processed());
                processed.add(identifier);
                return new RunState(
                    state.runDate(),
                    state.runId(),
                    state.startedAt(),
                    state.totalItems(),
                    processed,
                    state.errors(),
                    state.completed(),
                    state.finishedAt()
                );
            });
        }
    }

    public boolean recordError(String identifier) {
        return mutate(state -> {
            Map<String, Integer> errors = new LinkedHashMap<>(state.errors());
            errors.merge(identifier, 1, Integer::sum);
            return new RunState(
                state.runDate(),
                state.runId(),
                state.startedAt(),
                state.totalItems(),
                state.processed(),
                errors,
                state.completed(),
                state.finishedAt()
            );
        });
    }

    public boolean markCompleted() {
        return mutate(state -> new RunState(
            state.runDate(),
            state.runId(),
            state.startedAt(),
            state.totalItems(),
            state.processed(),
            state.errors(),
            true,
            clock.instant()
        ));
    }

    public boolean isCompleted() {
        synchronized (lock) {
            return current != null && current.completed();
        }
    }

    public boolean isCompletedToday() {
        RunState today = today();
        return today != null && today.completed();
    }

    public RunState today() {
        LocalDate date = LocalDate.now(clock);
        synchronized (lock) {
            if (current != null && date.equals(current.runDate())) {
                return current;
            }
        }
        return repository.find(date);
    }

    public RunState snapshot() {
        synchronized (lock) {
            return current;
        }
    }

    private boolean mutate(UnaryOperator<RunState> change) {
        synchronized (lock) {
            if (current == null) {
                throw new IllegalStateException("ensureToday must be called before updating run state");
            }
            RunState next = change.apply(current);
            try {
                repository.save(next);
            } catch (RecordPersistenceException e) {
                log.error("Failed to persist run state for {}; keeping previous state", current.runDate(), e);
                return false;
            }
            current = next;
            return true;
        }
    }
}
