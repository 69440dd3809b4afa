package com.changesentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One measured value of one metric at one instant.
 */
public final class MetricSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricId;
    private final Instant timestamp;
    private final double value;

    public MetricSample(String metricId, Instant timestamp, double value) {
        this.metricId = Objects.requireNonNull(metricId, "metricId must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    public String getMetricId() {
        return metricId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return Double.compare(value, that.value) == 0
                && metricId.equals(that.metricId)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricId, timestamp, value);
    }

    @Override
    public String toString() {
        return "MetricSample{" + metricId + " @ " + timestamp + " = " + value + '}';
    }
}
