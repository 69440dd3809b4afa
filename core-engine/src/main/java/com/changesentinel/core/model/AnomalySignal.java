package com.changesentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A confirmed anomaly on one metric.
 *
 * <p>
 * Created only by the breach tracker, at the moment a metric's breach streak
 * reaches its required length. A metric that stays in breach does not
 * produce further signals until it has recovered and re-confirmed.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code metricId}, {@code scope},
 * {@code breachType} and {@code onset} are required; omitting any of them
 * throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalySignal implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricId;
    private final String scope;
    private final String unit;
    private final CausationCategory category;
    private final BreachType breachType;
    private final Set<BreachType> breachTypes;
    private final double observedValue;
    private final Double baselineValue;
    private final Double delta;
    private final double threshold;
    private final double magnitude;
    private final int consecutiveCount;
    private final Instant onset;
    private final Instant detectedAt;
    private final Severity severity;

    private AnomalySignal(Builder b) {
        this.metricId = Objects.requireNonNull(b.metricId, "metricId must not be null");
        this.scope = Objects.requireNonNull(b.scope, "scope must not be null");
        this.unit = b.unit != null ? b.unit : "";
        this.category = b.category != null ? b.category : CausationCategory.DEPLOYMENT_GENERIC;
        this.breachType = Objects.requireNonNull(b.breachType, "breachType must not be null");
        EnumSet<BreachType> types = EnumSet.of(b.breachType);
        types.addAll(b.breachTypes);
        this.breachTypes = Collections.unmodifiableSet(types);
        this.observedValue = b.observedValue;
        this.baselineValue = b.baselineValue;
        this.delta = b.baselineValue != null ? b.observedValue - b.baselineValue : null;
        this.threshold = b.threshold;
        this.magnitude = b.magnitude;
        this.consecutiveCount = b.consecutiveCount;
        this.onset = Objects.requireNonNull(b.onset, "onset must not be null");
        this.detectedAt = b.detectedAt != null ? b.detectedAt : b.onset;
        this.severity = b.severity != null ? b.severity : Severity.fromExcess(b.magnitude, b.threshold);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalySignal}.
     */
    public static class Builder {
        private String metricId;
        private String scope;
        private String unit;
        private CausationCategory category;
        private BreachType breachType;
        private final Set<BreachType> breachTypes = EnumSet.noneOf(BreachType.class);
        private double observedValue;
        private Double baselineValue;
        private double threshold;
        private double magnitude;
        private int consecutiveCount = 1;
        private Instant onset;
        private Instant detectedAt;
        private Severity severity;

        public Builder metricId(String metricId) {
            this.metricId = metricId;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        public Builder category(CausationCategory category) {
            this.category = category;
            return this;
        }

        public Builder breachType(BreachType breachType) {
            this.breachType = breachType;
            return this;
        }

        public Builder breachTypes(Set<BreachType> breachTypes) {
            this.breachTypes.addAll(breachTypes);
            return this;
        }

        public Builder observedValue(double observedValue) {
            this.observedValue = observedValue;
            return this;
        }

        public Builder baselineValue(Double baselineValue) {
            this.baselineValue = baselineValue;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder magnitude(double magnitude) {
            this.magnitude = magnitude;
            return this;
        }

        public Builder consecutiveCount(int consecutiveCount) {
            this.consecutiveCount = consecutiveCount;
            return this;
        }

        public Builder onset(Instant onset) {
            this.onset = onset;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public AnomalySignal build() {
            return new AnomalySignal(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getMetricId() {
        return metricId;
    }

    public String getScope() {
        return scope;
    }

    public String getUnit() {
        return unit;
    }

    public CausationCategory getCategory() {
        return category;
    }

    /**
     * @return the breach type furthest past its threshold
     */
    public BreachType getBreachType() {
        return breachType;
    }

    /**
     * @return every breach type that fired on the confirming cycle
     */
    public Set<BreachType> getBreachTypes() {
        return breachTypes;
    }

    public double getObservedValue() {
        return observedValue;
    }

    public Double getBaselineValue() {
        return baselineValue;
    }

    /**
     * @return {@code observed - baseline}, or {@code null} without a baseline
     */
    public Double getDelta() {
        return delta;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getMagnitude() {
        return magnitude;
    }

    public int getConsecutiveCount() {
        return consecutiveCount;
    }

    /**
     * @return timestamp of the first breaching observation of the streak
     */
    public Instant getOnset() {
        return onset;
    }

    /**
     * @return timestamp of the observation that confirmed the streak
     */
    public Instant getDetectedAt() {
        return detectedAt;
    }

    public Severity getSeverity() {
        return severity;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalySignal that))
            return false;
        return metricId.equals(that.metricId)
                && breachType == that.breachType
                && onset.equals(that.onset)
                && detectedAt.equals(that.detectedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricId, breachType, onset, detectedAt);
    }

    @Override
    public String toString() {
        return "AnomalySignal{" +
                "metricId='" + metricId + '\'' +
                ", breachType=" + breachType +
                ", observed=" + observedValue +
                ", baseline=" + baselineValue +
                ", delta=" + delta +
                ", severity=" + severity +
                ", onset=" + onset +
                '}';
    }
}
