package com.changesentinel.service;

import com.changesentinel.core.model.CycleTrigger;
import com.changesentinel.core.orchestration.CycleConflictException;
import com.changesentinel.core.orchestration.CycleOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fires a {@link CycleTrigger#SCHEDULED} cycle at a fixed rate.
 *
 * <p>
 * A failing cycle is logged and never cancels the schedule. A tick that
 * finds a cycle still running is counted as rejected and skipped.
 * </p>
 */
public class CycleScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(CycleScheduler.class);

    private final CycleOrchestrator orchestrator;
    private final SentinelMetrics metrics;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public CycleScheduler(CycleOrchestrator orchestrator, SentinelMetrics metrics) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "CycleOrchestrator must not be null");
        this.metrics = Objects.requireNonNull(metrics, "SentinelMetrics must not be null");
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cycle-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @param initialDelaySeconds delay before the first cycle
     * @param intervalSeconds     time between cycle starts
     */
    public void start(long initialDelaySeconds, long intervalSeconds) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Scheduler already started");
        }
        executor.scheduleAtFixedRate(this::tick, initialDelaySeconds, intervalSeconds, TimeUnit.SECONDS);
        LOG.info("Cycle scheduler started: first cycle in {}s, then every {}s", initialDelaySeconds, intervalSeconds);
    }

    void tick() {
        try {
            orchestrator.runCycle(CycleTrigger.SCHEDULED);
        } catch (CycleConflictException e) {
            metrics.incrementCyclesRejected();
            LOG.warn("Scheduled cycle skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Scheduled cycle failed - schedule continues", e);
        }
    }

    public void stop() {
        executor.shutdownNow();
        LOG.info("Cycle scheduler stopped");
    }
}
