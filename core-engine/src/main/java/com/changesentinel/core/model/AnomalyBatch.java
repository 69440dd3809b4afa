package com.changesentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Every signal confirmed in one cycle, grouped by scope, together with the
 * cycle's metadata and the sources it had to skip.
 *
 * @since 1.0.0
 */
public final class AnomalyBatch implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String cycleId;
    private final CycleTrigger trigger;
    private final Instant startedAt;
    private final Duration duration;
    private final List<AnomalySignal> signals;
    private final Map<String, List<AnomalySignal>> signalsByScope;
    private final List<String> evaluatedMetrics;
    private final List<DegradedSource> degradedSources;

    private AnomalyBatch(Builder b) {
        this.cycleId = Objects.requireNonNull(b.cycleId, "cycleId must not be null");
        this.trigger = Objects.requireNonNull(b.trigger, "trigger must not be null");
        this.startedAt = Objects.requireNonNull(b.startedAt, "startedAt must not be null");
        this.duration = b.duration != null ? b.duration : Duration.ZERO;
        this.signals = List.copyOf(b.signals);
        Map<String, List<AnomalySignal>> grouped = new LinkedHashMap<>();
        for (AnomalySignal signal : b.signals) {
            grouped.computeIfAbsent(signal.getScope(), k -> new ArrayList<>()).add(signal);
        }
        grouped.replaceAll((scope, list) -> List.copyOf(list));
        this.signalsByScope = Collections.unmodifiableMap(grouped);
        this.evaluatedMetrics = List.copyOf(b.evaluatedMetrics);
        this.degradedSources = List.copyOf(b.degradedSources);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyBatch}.
     */
    public static class Builder {
        private String cycleId;
        private CycleTrigger trigger;
        private Instant startedAt;
        private Duration duration;
        private final List<AnomalySignal> signals = new ArrayList<>();
        private final List<String> evaluatedMetrics = new ArrayList<>();
        private final List<DegradedSource> degradedSources = new ArrayList<>();

        public Builder cycleId(String cycleId) {
            this.cycleId = cycleId;
            return this;
        }

        public Builder trigger(CycleTrigger trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder signals(List<AnomalySignal> signals) {
            this.signals.addAll(signals);
            return this;
        }

        public Builder evaluatedMetrics(List<String> evaluatedMetrics) {
            this.evaluatedMetrics.addAll(evaluatedMetrics);
            return this;
        }

        public Builder degradedSources(List<DegradedSource> degradedSources) {
            this.degradedSources.addAll(degradedSources);
            return this;
        }

        public AnomalyBatch build() {
            return new AnomalyBatch(this);
        }
    }

    public String getCycleId() {
        return cycleId;
    }

    public CycleTrigger getTrigger() {
        return trigger;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Duration getDuration() {
        return duration;
    }

    public List<AnomalySignal> getSignals() {
        return signals;
    }

    public Map<String, List<AnomalySignal>> getSignalsByScope() {
        return signalsByScope;
    }

    public List<String> getEvaluatedMetrics() {
        return evaluatedMetrics;
    }

    public List<DegradedSource> getDegradedSources() {
        return degradedSources;
    }

    public boolean isDegraded() {
        return !degradedSources.isEmpty();
    }

    @Override
    public String toString() {
        return "AnomalyBatch{" +
                "cycleId='" + cycleId + '\'' +
                ", trigger=" + trigger +
                ", startedAt=" + startedAt +
                ", duration=" + duration +
                ", signals=" + signals.size() +
                ", evaluated=" + evaluatedMetrics.size() +
                ", degraded=" + degradedSources.size() +
                '}';
    }
}
