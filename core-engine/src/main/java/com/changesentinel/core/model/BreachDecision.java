package com.changesentinel.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of evaluating one metric window against its definition for one
 * cycle: no breach, or one breach per fired check.
 *
 * @since 1.0.0
 */
public final class BreachDecision {

    private final String metricId;
    private final Instant observedAt;
    private final double currentValue;
    private final Double baselineValue;
    private final List<Breach> breaches;

    public BreachDecision(String metricId, Instant observedAt, double currentValue,
            Double baselineValue, List<Breach> breaches) {
        this.metricId = Objects.requireNonNull(metricId, "metricId must not be null");
        this.observedAt = Objects.requireNonNull(observedAt, "observedAt must not be null");
        this.currentValue = currentValue;
        this.baselineValue = baselineValue;
        this.breaches = breaches != null ? List.copyOf(breaches) : Collections.emptyList();
    }

    public String getMetricId() {
        return metricId;
    }

    /**
     * @return timestamp of the latest current sample the decision was based on
     */
    public Instant getObservedAt() {
        return observedAt;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    /**
     * @return baseline mean, or {@code null} when no baseline samples existed
     */
    public Double getBaselineValue() {
        return baselineValue;
    }

    /**
     * @return {@code current - baseline}, or {@code null} without a baseline
     */
    public Double getDelta() {
        return baselineValue != null ? currentValue - baselineValue : null;
    }

    public List<Breach> getBreaches() {
        return breaches;
    }

    public boolean isBreach() {
        return !breaches.isEmpty();
    }

    /**
     * @return the breach furthest past its threshold, if any
     */
    public Optional<Breach> primaryBreach() {
        return breaches.stream().max(Comparator.comparingDouble(Breach::excessRatio));
    }

    @Override
    public String toString() {
        return "BreachDecision{" + metricId + " @ " + observedAt + ", current=" + currentValue
                + ", baseline=" + baselineValue + ", breaches=" + breaches + '}';
    }
}
