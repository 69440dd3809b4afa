package com.changesentinel.core.aggregation;

import com.changesentinel.core.model.AnomalyBatch;
import com.changesentinel.core.model.AnomalySignal;
import com.changesentinel.core.model.BreachType;
import com.changesentinel.core.model.CycleTrigger;
import com.changesentinel.core.model.DegradationReason;
import com.changesentinel.core.model.DegradedSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnomalyAggregator}.
 */
class AnomalyAggregatorTest {

    private static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    private final AnomalyAggregator aggregator = new AnomalyAggregator();

    @Test
    @DisplayName("Should group signals by scope in outcome order")
    void shouldGroupByScope() {
        List<MetricOutcome> outcomes = List.of(
                MetricOutcome.evaluated("redis.memory", signal("redis", "redis.memory")),
                MetricOutcome.evaluated("rds.cpu", signal("rds", "rds.cpu")),
                MetricOutcome.evaluated("rds.connections", null),
                MetricOutcome.evaluated("redis.evictions", signal("redis", "redis.evictions")));

        AnomalyBatch batch = aggregate(outcomes, List.of());

        assertThat(batch.getSignals()).extracting(AnomalySignal::getMetricId)
                .containsExactly("redis.memory", "rds.cpu", "redis.evictions");
        assertThat(batch.getSignalsByScope()).containsOnlyKeys("redis", "rds");
        assertThat(batch.getSignalsByScope().keySet()).containsExactly("redis", "rds");
        assertThat(batch.getSignalsByScope().get("redis")).hasSize(2);
        assertThat(batch.getEvaluatedMetrics())
                .containsExactly("redis.memory", "rds.cpu", "rds.connections", "redis.evictions");
        assertThat(batch.isDegraded()).isFalse();
    }

    @Test
    @DisplayName("Should record degraded metrics and feeds without evaluating them")
    void shouldRecordDegradedSources() {
        DegradedSource timeout = new DegradedSource("rds.cpu", "rds", DegradationReason.TIMEOUT, "slow");
        DegradedSource feed = new DegradedSource("deployments:rds", "rds", DegradationReason.UNAVAILABLE, "down");

        AnomalyBatch batch = aggregate(List.of(
                MetricOutcome.degraded(timeout),
                MetricOutcome.evaluated("redis.memory", null)), List.of(feed));

        assertThat(batch.getEvaluatedMetrics()).containsExactly("redis.memory");
        assertThat(batch.getDegradedSources()).containsExactly(timeout, feed);
        assertThat(batch.isDegraded()).isTrue();
    }

    @Test
    @DisplayName("Should produce an empty batch for an empty cycle and skip null outcomes")
    void shouldHandleEmptyAndNullOutcomes() {
        List<MetricOutcome> outcomes = new ArrayList<>();
        outcomes.add(null);

        AnomalyBatch batch = aggregate(outcomes, null);

        assertThat(batch.getSignals()).isEmpty();
        assertThat(batch.getSignalsByScope()).isEmpty();
        assertThat(batch.getEvaluatedMetrics()).isEmpty();
        assertThat(batch.getCycleId()).isEqualTo("cycle-1");
        assertThat(batch.getTrigger()).isEqualTo(CycleTrigger.SCHEDULED);
    }

    @Test
    @DisplayName("Should keep only the first signal of a metric")
    void shouldDropDuplicateSignals() {
        AnomalyBatch batch = aggregate(List.of(
                MetricOutcome.evaluated("rds.cpu", signal("rds", "rds.cpu")),
                MetricOutcome.evaluated("rds.cpu", signal("rds", "rds.cpu"))), List.of());

        assertThat(batch.getSignals()).hasSize(1);
    }

    private AnomalyBatch aggregate(List<MetricOutcome> outcomes, List<DegradedSource> additional) {
        return aggregator.aggregate("cycle-1", CycleTrigger.SCHEDULED, START, Duration.ofSeconds(3),
                outcomes, additional);
    }

    private static AnomalySignal signal(String scope, String metricId) {
        return AnomalySignal.builder()
                .metricId(metricId)
                .scope(scope)
                .breachType(BreachType.ABSOLUTE)
                .observedValue(90)
                .threshold(80)
                .magnitude(10)
                .onset(START)
                .build();
    }
}
