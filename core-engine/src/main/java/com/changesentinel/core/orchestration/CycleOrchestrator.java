package com.changesentinel.core.orchestration;

import com.changesentinel.core.aggregation.AnomalyAggregator;
import com.changesentinel.core.aggregation.MetricOutcome;
import com.changesentinel.core.config.CycleSettings;
import com.changesentinel.core.config.MetricRegistry;
import com.changesentinel.core.correlation.DeploymentCorrelator;
import com.changesentinel.core.correlation.ScopeRelations;
import com.changesentinel.core.detection.ThresholdEvaluator;
import com.changesentinel.core.model.AnomalyBatch;
import com.changesentinel.core.model.AnomalyReport;
import com.changesentinel.core.model.AnomalySignal;
import com.changesentinel.core.model.BreachDecision;
import com.changesentinel.core.model.CycleTrigger;
import com.changesentinel.core.model.DegradationReason;
import com.changesentinel.core.model.DegradedSource;
import com.changesentinel.core.model.DeploymentEvent;
import com.changesentinel.core.model.MetricDefinition;
import com.changesentinel.core.model.MetricSample;
import com.changesentinel.core.model.MetricWindow;
import com.changesentinel.core.model.RcaFinding;
import com.changesentinel.core.report.ReportHistory;
import com.changesentinel.core.report.ReportPublisher;
import com.changesentinel.core.source.DeploymentFeed;
import com.changesentinel.core.source.SampleSource;
import com.changesentinel.core.source.SourceUnavailableException;
import com.changesentinel.core.source.WindowSpec;
import com.changesentinel.core.tracking.BreachTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs one detection and correlation cycle per trigger.
 *
 * <h3>Cycle</h3>
 * <ol>
 * <li>Fan out one task per registered metric on a fixed pool of
 * {@code maxConcurrentFetches} threads. Each task fetches the current window,
 * then the baseline window, each bounded by {@code fetchTimeout}, and
 * evaluates the result. Source calls themselves run on a second pool of the
 * same size. A failed baseline fetch only costs the relative check.</li>
 * <li>Wait for all tasks up to the cycle deadline. Unfinished tasks are
 * cancelled and their metrics degraded with {@code DEADLINE_EXCEEDED}.</li>
 * <li>Feed each decision to the {@link BreachTracker} on this thread, so no
 * tracker transition is ever left half-done by a cancelled task.</li>
 * <li>Fetch deployments for every scope carrying a signal (plus its related
 * scopes) in parallel, within {@code fetchTimeout} and the time left before
 * the cycle deadline. Aggregate, correlate.</li>
 * <li>Store the report in the {@link ReportHistory}, then hand it to every
 * {@link ReportPublisher}.</li>
 * </ol>
 *
 * <h3>Concurrency</h3>
 * <p>
 * At most one cycle runs at a time. A trigger arriving while a cycle is in
 * flight fails with {@link CycleConflictException}. Every accepted trigger
 * produces exactly one report, degraded or not.
 * </p>
 *
 * @since 1.0.0
 */
public class CycleOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CycleOrchestrator.class);

    /** Prefix of the source id used when a deployment feed is degraded. */
    public static final String DEPLOYMENTS_SOURCE_PREFIX = "deployments:";

    private final MetricRegistry registry;
    private final SampleSource sampleSource;
    private final DeploymentFeed deploymentFeed;
    private final ThresholdEvaluator evaluator;
    private final BreachTracker tracker;
    private final AnomalyAggregator aggregator;
    private final DeploymentCorrelator correlator;
    private final ScopeRelations scopeRelations;
    private final Duration correlationWindow;
    private final ReportHistory history;
    private final List<ReportPublisher> publishers;
    private final Duration fetchTimeout;
    private final Duration deadline;
    private final Clock clock;
    private final Supplier<String> cycleIds;

    private final ExecutorService fetchPool;
    private final ExecutorService ioExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private CycleOrchestrator(Builder b) {
        this.registry = Objects.requireNonNull(b.registry, "MetricRegistry must not be null");
        this.sampleSource = Objects.requireNonNull(b.sampleSource, "SampleSource must not be null");
        this.deploymentFeed = b.deploymentFeed != null ? b.deploymentFeed : DeploymentFeed.NONE;
        this.evaluator = b.evaluator != null ? b.evaluator : new ThresholdEvaluator();
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.tracker = b.tracker != null ? b.tracker : new BreachTracker(clock);
        this.aggregator = b.aggregator != null ? b.aggregator : new AnomalyAggregator();
        this.correlator = b.correlator != null ? b.correlator : new DeploymentCorrelator();
        this.scopeRelations = b.scopeRelations != null ? b.scopeRelations : ScopeRelations.none();
        this.correlationWindow = b.correlationWindow != null ? b.correlationWindow : Duration.ofHours(1);
        CycleSettings cycle = b.cycleSettings != null ? b.cycleSettings : new CycleSettings();
        this.history = b.history != null ? b.history : new ReportHistory(cycle.getHistorySize());
        this.publishers = List.copyOf(b.publishers);
        this.fetchTimeout = b.fetchTimeout != null ? b.fetchTimeout : cycle.fetchTimeout();
        this.deadline = b.deadline != null ? b.deadline : cycle.deadline();
        this.cycleIds = b.cycleIds != null ? b.cycleIds : () -> UUID.randomUUID().toString();

        this.fetchPool = Executors.newFixedThreadPool(cycle.getMaxConcurrentFetches(), daemonThreads("sentinel-fetch"));
        this.ioExecutor = Executors.newFixedThreadPool(cycle.getMaxConcurrentFetches(), daemonThreads("sentinel-io"));

        LOG.info("CycleOrchestrator ready: {} metric(s), {} concurrent fetch(es), fetchTimeout={}, deadline={}",
                registry.size(), cycle.getMaxConcurrentFetches(), fetchTimeout, deadline);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Cycle
    // ---------------------------------------------------------------

    /**
     * Run one cycle.
     *
     * @param trigger what started the cycle
     * @return the cycle's report
     * @throws CycleConflictException if a cycle is already running
     */
    public AnomalyReport runCycle(CycleTrigger trigger) {
        Objects.requireNonNull(trigger, "CycleTrigger must not be null");
        if (!running.compareAndSet(false, true)) {
            LOG.warn("{} cycle rejected: cycle already running", trigger);
            throw new CycleConflictException("cycle already running");
        }
        try {
            return doRunCycle(trigger);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private AnomalyReport doRunCycle(CycleTrigger trigger) {
        String cycleId = cycleIds.get();
        Instant startedAt = clock.instant();
        long deadlineNanos = System.nanoTime() + deadline.toNanos();
        LOG.info("Cycle [{}] started ({})", cycleId, trigger);

        List<MetricDefinition> metrics = new ArrayList<>(registry.all());
        List<MetricOutcome> outcomes = evaluateAll(cycleId, metrics, startedAt);

        List<AnomalySignal> signals = new ArrayList<>();
        outcomes.forEach(o -> o.getSignal().ifPresent(signals::add));

        List<DegradedSource> feedDegradations = new ArrayList<>();
        List<DeploymentEvent> deployments = signals.isEmpty()
                ? List.of()
                : fetchDeployments(signals, deadlineNanos, feedDegradations);

        AnomalyBatch batch = aggregator.aggregate(cycleId, trigger, startedAt,
                Duration.between(startedAt, clock.instant()), outcomes, feedDegradations);
        List<RcaFinding> findings = correlator.correlate(batch, deployments, correlationWindow);
        AnomalyReport report = new AnomalyReport(batch, findings);

        history.add(report);
        publish(report);

        LOG.info("Cycle [{}] finished: {} evaluated, {} signal(s), {} finding(s), {} degraded source(s)",
                cycleId, batch.getEvaluatedMetrics().size(), signals.size(), findings.size(),
                batch.getDegradedSources().size());
        return report;
    }

    private List<MetricOutcome> evaluateAll(String cycleId, List<MetricDefinition> metrics, Instant now) {
        List<Callable<FetchResult>> tasks = new ArrayList<>(metrics.size());
        for (MetricDefinition metric : metrics) {
            tasks.add(() -> fetchAndEvaluate(metric, now));
        }

        List<Future<FetchResult>> futures;
        try {
            futures = fetchPool.invokeAll(tasks, deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Cycle [{}] interrupted while waiting for metrics", cycleId);
            List<MetricOutcome> outcomes = new ArrayList<>();
            for (MetricDefinition metric : metrics) {
                outcomes.add(degraded(metric, DegradationReason.DEADLINE_EXCEEDED, "cycle interrupted"));
            }
            return outcomes;
        }

        List<MetricOutcome> outcomes = new ArrayList<>(metrics.size());
        for (int i = 0; i < metrics.size(); i++) {
            MetricDefinition metric = metrics.get(i);
            outcomes.add(collect(cycleId, metric, futures.get(i)));
        }
        return outcomes;
    }

    private MetricOutcome collect(String cycleId, MetricDefinition metric, Future<FetchResult> future) {
        FetchResult result;
        try {
            result = future.get();
        } catch (CancellationException e) {
            LOG.warn("Cycle [{}]: metric {} did not finish before the {} deadline", cycleId, metric.id(), deadline);
            return degraded(metric, DegradationReason.DEADLINE_EXCEEDED,
                    "not finished within cycle deadline " + deadline);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return degraded(metric, DegradationReason.DEADLINE_EXCEEDED, "cycle interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SourceUnavailableException unavailable) {
                LOG.warn("Cycle [{}]: source unavailable for {} ({}): {}", cycleId, metric.id(),
                        unavailable.getReason(), unavailable.getMessage());
                return degraded(metric, unavailable.getReason(), unavailable.getMessage());
            }
            LOG.error("Cycle [{}]: metric {} failed", cycleId, metric.id(), cause);
            return degraded(metric, DegradationReason.ERROR, String.valueOf(cause));
        }

        if (result.decision == null) {
            LOG.info("Cycle [{}]: no current samples for {}", cycleId, metric.id());
            return degraded(metric, DegradationReason.NO_DATA, "current window is empty");
        }
        Optional<AnomalySignal> signal = tracker.track(metric, result.decision);
        return MetricOutcome.evaluated(metric.id(), signal.orElse(null));
    }

    /**
     * Runs on a fetch-pool thread. Pure with respect to tracker state.
     */
    private FetchResult fetchAndEvaluate(MetricDefinition metric, Instant now)
            throws SourceUnavailableException, InterruptedException {
        List<MetricSample> current = fetch(metric, WindowSpec.current(metric, now, fetchTimeout));
        if (current.isEmpty()) {
            return new FetchResult(null);
        }
        List<MetricSample> baseline;
        try {
            baseline = fetch(metric, WindowSpec.baseline(metric, now, fetchTimeout));
        } catch (SourceUnavailableException e) {
            LOG.info("Baseline unavailable for {} ({}): {} - evaluating without baseline",
                    metric.id(), e.getReason(), e.getMessage());
            baseline = List.of();
        }

        MetricWindow window = MetricWindow.builder(metric.id())
                .currentAll(current)
                .baselineAll(baseline)
                .build();
        BreachDecision decision = evaluator.evaluate(window, metric);
        return new FetchResult(decision);
    }

    private List<MetricSample> fetch(MetricDefinition metric, WindowSpec window)
            throws SourceUnavailableException, InterruptedException {
        return withTimeout(() -> sampleSource.fetchSamples(metric, window), metric.id());
    }

    // ---------------------------------------------------------------
    // Deployments
    // ---------------------------------------------------------------

    /**
     * Fetch deployments for every scope concurrently. All calls share one
     * wait bounded by {@code fetchTimeout} and by what is left of the cycle
     * deadline; calls still running then are cancelled and degraded.
     */
    private List<DeploymentEvent> fetchDeployments(List<AnomalySignal> signals, long deadlineNanos,
            List<DegradedSource> degradations) {
        // deployment scope -> earliest "since" over every signal scope that needs it
        Map<String, Instant> since = new LinkedHashMap<>();
        for (AnomalySignal signal : signals) {
            Instant from = signal.getOnset().minus(correlationWindow);
            for (String scope : scopeRelations.scopesFor(signal.getScope())) {
                since.merge(scope, from, (a, b) -> a.isBefore(b) ? a : b);
            }
        }

        long now = System.nanoTime();
        long remaining = deadlineNanos - now;
        if (remaining <= 0) {
            LOG.warn("Cycle deadline {} spent before deployment lookup - {} scope(s) skipped",
                    deadline, since.size());
            for (String scope : since.keySet()) {
                degradations.add(new DegradedSource(DEPLOYMENTS_SOURCE_PREFIX + scope, scope,
                        DegradationReason.DEADLINE_EXCEEDED, "cycle deadline " + deadline + " spent"));
            }
            return List.of();
        }
        boolean deadlineBound = remaining < fetchTimeout.toNanos();
        long waitUntil = now + Math.min(remaining, fetchTimeout.toNanos());

        Map<String, Future<List<DeploymentEvent>>> pending = new LinkedHashMap<>();
        for (Map.Entry<String, Instant> entry : since.entrySet()) {
            String scope = entry.getKey();
            Instant from = entry.getValue();
            Callable<List<DeploymentEvent>> call = () -> deploymentFeed.fetchDeploymentEvents(scope, from);
            pending.put(scope, ioExecutor.submit(call));
        }

        List<DeploymentEvent> deployments = new ArrayList<>();
        boolean interrupted = false;
        for (Map.Entry<String, Future<List<DeploymentEvent>>> entry : pending.entrySet()) {
            String scope = entry.getKey();
            String sourceId = DEPLOYMENTS_SOURCE_PREFIX + scope;
            Future<List<DeploymentEvent>> future = entry.getValue();
            if (interrupted) {
                future.cancel(true);
                degradations.add(new DegradedSource(sourceId, scope, DegradationReason.DEADLINE_EXCEEDED,
                        "interrupted"));
                continue;
            }
            try {
                long wait = Math.max(0, waitUntil - System.nanoTime());
                deployments.addAll(future.get(wait, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                DegradationReason reason = deadlineBound
                        ? DegradationReason.DEADLINE_EXCEEDED
                        : DegradationReason.TIMEOUT;
                LOG.warn("Deployment feed for scope {} did not answer in time ({})", scope, reason);
                degradations.add(new DegradedSource(sourceId, scope, reason,
                        deadlineBound ? "not finished within cycle deadline " + deadline
                                : sourceId + " did not answer within " + fetchTimeout));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                future.cancel(true);
                degradations.add(new DegradedSource(sourceId, scope, DegradationReason.DEADLINE_EXCEEDED,
                        "interrupted"));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof SourceUnavailableException unavailable) {
                    LOG.warn("Deployment feed unavailable for scope {} ({}): {}", scope,
                            unavailable.getReason(), unavailable.getMessage());
                    degradations.add(new DegradedSource(sourceId, scope, unavailable.getReason(),
                            unavailable.getMessage()));
                } else {
                    LOG.error("Deployment feed failed for scope {}", scope, cause);
                    degradations.add(new DegradedSource(sourceId, scope, DegradationReason.ERROR,
                            String.valueOf(cause)));
                }
            }
        }
        return deployments;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /**
     * Run a source call on the I/O executor, interrupting it once
     * {@code fetchTimeout} has passed.
     */
    private <T> T withTimeout(SourceCall<T> call, String sourceId)
            throws SourceUnavailableException, InterruptedException {
        Callable<T> task = call::call;
        Future<T> future = ioExecutor.submit(task);
        try {
            return future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SourceUnavailableException(DegradationReason.TIMEOUT,
                    sourceId + " did not answer within " + fetchTimeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SourceUnavailableException unavailable) {
                throw unavailable;
            }
            throw new SourceUnavailableException(DegradationReason.ERROR,
                    sourceId + " failed: " + cause, cause);
        }
    }

    private void publish(AnomalyReport report) {
        for (ReportPublisher publisher : publishers) {
            try {
                publisher.publish(report);
            } catch (RuntimeException e) {
                LOG.error("Report publisher {} failed for cycle [{}] - continuing with next publisher",
                        publisher.getClass().getSimpleName(), report.getCycleId(), e);
            }
        }
    }

    private static MetricOutcome degraded(MetricDefinition metric, DegradationReason reason, String message) {
        return MetricOutcome.degraded(new DegradedSource(metric.id(), metric.getScope(), reason, message));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public ReportHistory getHistory() {
        return history;
    }

    public BreachTracker getTracker() {
        return tracker;
    }

    @Override
    public void close() {
        LOG.info("CycleOrchestrator shutting down");
        fetchPool.shutdownNow();
        ioExecutor.shutdownNow();
    }

    // ---------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface SourceCall<T> {
        T call() throws SourceUnavailableException;
    }

    private static final class FetchResult {
        /** {@code null} when the current window was empty. */
        final BreachDecision decision;

        FetchResult(BreachDecision decision) {
            this.decision = decision;
        }
    }

    /**
     * Fluent builder for {@link CycleOrchestrator}. Registry and sample source
     * are required; everything else has a default.
     */
    public static final class Builder {
        private MetricRegistry registry;
        private SampleSource sampleSource;
        private DeploymentFeed deploymentFeed;
        private ThresholdEvaluator evaluator;
        private BreachTracker tracker;
        private AnomalyAggregator aggregator;
        private DeploymentCorrelator correlator;
        private ScopeRelations scopeRelations;
        private Duration correlationWindow;
        private ReportHistory history;
        private final List<ReportPublisher> publishers = new ArrayList<>();
        private CycleSettings cycleSettings;
        private Duration fetchTimeout;
        private Duration deadline;
        private Clock clock;
        private Supplier<String> cycleIds;

        public Builder registry(MetricRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder sampleSource(SampleSource sampleSource) {
            this.sampleSource = sampleSource;
            return this;
        }

        public Builder deploymentFeed(DeploymentFeed deploymentFeed) {
            this.deploymentFeed = deploymentFeed;
            return this;
        }

        public Builder evaluator(ThresholdEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder tracker(BreachTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        public Builder aggregator(AnomalyAggregator aggregator) {
            this.aggregator = aggregator;
            return this;
        }

        public Builder correlator(DeploymentCorrelator correlator) {
            this.correlator = correlator;
            return this;
        }

        public Builder scopeRelations(ScopeRelations scopeRelations) {
            this.scopeRelations = scopeRelations;
            return this;
        }

        public Builder correlationWindow(Duration correlationWindow) {
            this.correlationWindow = correlationWindow;
            return this;
        }

        public Builder history(ReportHistory history) {
            this.history = history;
            return this;
        }

        public Builder publisher(ReportPublisher publisher) {
            this.publishers.add(Objects.requireNonNull(publisher, "ReportPublisher must not be null"));
            return this;
        }

        public Builder cycleSettings(CycleSettings cycleSettings) {
            this.cycleSettings = cycleSettings;
            return this;
        }

        /**
         * Override {@link CycleSettings#fetchTimeout()} with a finer value.
         */
        public Builder fetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
            return this;
        }

        /**
         * Override {@link CycleSettings#deadline()} with a finer value.
         */
        public Builder deadline(Duration deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder cycleIds(Supplier<String> cycleIds) {
            this.cycleIds = cycleIds;
            return this;
        }

        public CycleOrchestrator build() {
            return new CycleOrchestrator(this);
        }
    }
}
