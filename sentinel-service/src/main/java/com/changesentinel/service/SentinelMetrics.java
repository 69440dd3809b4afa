package com.changesentinel.service;

import com.changesentinel.core.model.AnomalyReport;
import com.changesentinel.core.report.ReportPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.Objects;

/**
 * Micrometer metric definitions for the sentinel.
 * <p>
 * Registered as a {@link ReportPublisher}, so every completed cycle updates
 * the counters once. Where the meters end up is decided by the
 * {@link MeterRegistry} the service is started with.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code sentinel.cycles.completed} - cycles that produced a report, tagged by trigger</li>
 *   <li>{@code sentinel.cycles.rejected} - triggers refused because a cycle was running</li>
 *   <li>{@code sentinel.signals.emitted} - confirmed anomalies</li>
 *   <li>{@code sentinel.sources.degraded} - sources skipped, metrics and deployment feeds</li>
 *   <li>{@code sentinel.cycle.duration} - wall time of each cycle</li>
 * </ul>
 */
public class SentinelMetrics implements ReportPublisher {

    private final MeterRegistry registry;
    private final Counter cyclesRejected;
    private final Counter signalsEmitted;
    private final Counter sourcesDegraded;
    private final Timer cycleDuration;

    public SentinelMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");
        this.cyclesRejected = Counter.builder("sentinel.cycles.rejected")
                .description("Cycle triggers rejected because a cycle was already running")
                .register(registry);
        this.signalsEmitted = Counter.builder("sentinel.signals.emitted")
                .description("Confirmed anomaly signals")
                .register(registry);
        this.sourcesDegraded = Counter.builder("sentinel.sources.degraded")
                .description("Sources skipped during a cycle")
                .register(registry);
        this.cycleDuration = Timer.builder("sentinel.cycle.duration")
                .description("Duration of detection cycles")
                .register(registry);
    }

    @Override
    public void publish(AnomalyReport report) {
        Counter.builder("sentinel.cycles.completed")
                .description("Detection cycles that produced a report")
                .tag("trigger", report.getBatch().getTrigger().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
        signalsEmitted.increment(report.getBatch().getSignals().size());
        sourcesDegraded.increment(report.getBatch().getDegradedSources().size());
        cycleDuration.record(report.getBatch().getDuration());
    }

    public void incrementCyclesRejected() {
        cyclesRejected.increment();
    }
}
