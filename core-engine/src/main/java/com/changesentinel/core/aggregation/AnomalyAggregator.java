package com.changesentinel.core.aggregation;

import com.changesentinel.core.model.AnomalyBatch;
import com.changesentinel.core.model.AnomalySignal;
import com.changesentinel.core.model.CycleTrigger;
import com.changesentinel.core.model.DegradedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Collects the per-metric outcomes of one cycle into an
 * {@link AnomalyBatch}.
 *
 * <p>
 * Stateless. Signals keep the order of the outcomes (registry order), and
 * are grouped by scope in that order. A metric reported more than once keeps
 * its first signal. The aggregator never fails a batch: a {@code null}
 * outcome is logged and skipped.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyAggregator.class);

    /**
     * @param cycleId    identifier of the cycle
     * @param trigger    what started the cycle
     * @param startedAt  cycle start
     * @param duration   cycle duration so far
     * @param outcomes   one outcome per registered metric
     * @param additional degradations not tied to a metric, e.g. deployment
     *                   feeds
     * @return the batch
     */
    public AnomalyBatch aggregate(String cycleId, CycleTrigger trigger, Instant startedAt,
            Duration duration, List<MetricOutcome> outcomes, List<DegradedSource> additional) {
        Objects.requireNonNull(outcomes, "outcomes must not be null");

        List<AnomalySignal> signals = new ArrayList<>();
        Set<String> signalled = new LinkedHashSet<>();
        Set<String> evaluated = new LinkedHashSet<>();
        List<DegradedSource> degraded = new ArrayList<>();

        for (MetricOutcome outcome : outcomes) {
            if (outcome == null) {
                LOG.warn("Cycle [{}]: null metric outcome skipped", cycleId);
                continue;
            }
            if (!outcome.isEvaluated()) {
                degraded.add(outcome.getDegraded().orElseThrow());
                continue;
            }
            evaluated.add(outcome.getMetricId());
            outcome.getSignal().ifPresent(signal -> {
                if (signalled.add(signal.getMetricId())) {
                    signals.add(signal);
                } else {
                    LOG.warn("Cycle [{}]: duplicate signal for {} dropped", cycleId, signal.getMetricId());
                }
            });
        }
        if (additional != null) {
            additional.stream().filter(Objects::nonNull).forEach(degraded::add);
        }

        AnomalyBatch batch = AnomalyBatch.builder()
                .cycleId(cycleId)
                .trigger(trigger)
                .startedAt(startedAt)
                .duration(duration)
                .signals(signals)
                .evaluatedMetrics(new ArrayList<>(evaluated))
                .degradedSources(degraded)
                .build();
        LOG.debug("Cycle [{}] aggregated: {} signal(s) across {} scope(s), {} evaluated, {} degraded",
                cycleId, signals.size(), batch.getSignalsByScope().size(), evaluated.size(), degraded.size());
        return batch;
    }
}
