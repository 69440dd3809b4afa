package com.changesentinel.core.aggregation;

import com.changesentinel.core.model.AnomalySignal;
import com.changesentinel.core.model.DegradedSource;

import java.util.Objects;
import java.util.Optional;

/**
 * What one metric contributed to a cycle: either it was evaluated (possibly
 * producing a signal) or its source was degraded.
 *
 * @since 1.0.0
 */
public final class MetricOutcome {

    private final String metricId;
    private final AnomalySignal signal;
    private final DegradedSource degraded;

    private MetricOutcome(String metricId, AnomalySignal signal, DegradedSource degraded) {
        this.metricId = Objects.requireNonNull(metricId, "metricId must not be null");
        this.signal = signal;
        this.degraded = degraded;
    }

    /**
     * @param metricId the evaluated metric
     * @param signal   the signal the tracker emitted, or {@code null}
     */
    public static MetricOutcome evaluated(String metricId, AnomalySignal signal) {
        return new MetricOutcome(metricId, signal, null);
    }

    public static MetricOutcome degraded(DegradedSource degraded) {
        Objects.requireNonNull(degraded, "DegradedSource must not be null");
        return new MetricOutcome(degraded.getSourceId(), null, degraded);
    }

    public String getMetricId() {
        return metricId;
    }

    public boolean isEvaluated() {
        return degraded == null;
    }

    public Optional<AnomalySignal> getSignal() {
        return Optional.ofNullable(signal);
    }

    public Optional<DegradedSource> getDegraded() {
        return Optional.ofNullable(degraded);
    }

    @Override
    public String toString() {
        return isEvaluated()
                ? "MetricOutcome{" + metricId + ", signal=" + (signal != null) + '}'
                : "MetricOutcome{" + metricId + ", degraded=" + degraded.getReason() + '}';
    }
}
