package com.changesentinel.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Current-period and baseline-period samples of one metric for one
 * evaluation cycle.
 *
 * <p>
 * Both sample lists are ordered by timestamp and hold at most one sample per
 * timestamp: the {@link Builder} keeps the last sample written for a given
 * instant, so replayed or duplicated points do not skew the window mean.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricWindow {

    private final String metricId;
    private final List<MetricSample> current;
    private final List<MetricSample> baseline;

    private MetricWindow(Builder builder) {
        this.metricId = builder.metricId;
        this.current = Collections.unmodifiableList(new ArrayList<>(builder.current.values()));
        this.baseline = Collections.unmodifiableList(new ArrayList<>(builder.baseline.values()));
    }

    public static Builder builder(String metricId) {
        return new Builder(metricId);
    }

    public String getMetricId() {
        return metricId;
    }

    public List<MetricSample> getCurrent() {
        return current;
    }

    public List<MetricSample> getBaseline() {
        return baseline;
    }

    public boolean hasCurrentData() {
        return !current.isEmpty();
    }

    /**
     * @return arithmetic mean of the current samples, empty when there are none
     */
    public OptionalDouble currentMean() {
        return mean(current);
    }

    /**
     * @return arithmetic mean of the baseline samples, empty when there are none
     */
    public OptionalDouble baselineMean() {
        return mean(baseline);
    }

    /**
     * @return the most recent current sample
     */
    public Optional<MetricSample> latestCurrent() {
        return current.isEmpty() ? Optional.empty() : Optional.of(current.get(current.size() - 1));
    }

    private static OptionalDouble mean(List<MetricSample> samples) {
        return samples.stream().mapToDouble(MetricSample::getValue).average();
    }

    @Override
    public String toString() {
        return "MetricWindow{" + metricId + ", current=" + current.size()
                + ", baseline=" + baseline.size() + '}';
    }

    /**
     * Collects samples into a window, ordering by timestamp and collapsing
     * duplicate timestamps (last write wins).
     */
    public static final class Builder {
        private final String metricId;
        private final Map<Instant, MetricSample> current = new TreeMap<>();
        private final Map<Instant, MetricSample> baseline = new TreeMap<>();

        private Builder(String metricId) {
            this.metricId = Objects.requireNonNull(metricId, "metricId must not be null");
        }

        public Builder current(MetricSample sample) {
            current.put(checked(sample).getTimestamp(), sample);
            return this;
        }

        public Builder currentAll(Iterable<MetricSample> samples) {
            samples.forEach(this::current);
            return this;
        }

        public Builder baseline(MetricSample sample) {
            baseline.put(checked(sample).getTimestamp(), sample);
            return this;
        }

        public Builder baselineAll(Iterable<MetricSample> samples) {
            samples.forEach(this::baseline);
            return this;
        }

        public MetricWindow build() {
            return new MetricWindow(this);
        }

        private MetricSample checked(MetricSample sample) {
            Objects.requireNonNull(sample, "sample must not be null");
            if (!metricId.equals(sample.getMetricId())) {
                throw new IllegalArgumentException("Sample for '" + sample.getMetricId()
                        + "' does not belong to window of '" + metricId + "'");
            }
            return sample;
        }
    }
}
