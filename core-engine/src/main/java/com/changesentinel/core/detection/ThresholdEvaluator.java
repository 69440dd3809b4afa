package com.changesentinel.core.detection;

import com.changesentinel.core.model.Breach;
import com.changesentinel.core.model.BreachDecision;
import com.changesentinel.core.model.MetricDefinition;
import com.changesentinel.core.model.MetricSample;
import com.changesentinel.core.model.MetricWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Evaluates one metric window against its definition.
 *
 * <p>
 * The representative value of each window is the arithmetic mean of its
 * samples. Every check selected by the definition's comparison mode runs
 * independently, so a single decision can carry both an absolute and a
 * relative breach.
 * </p>
 *
 * <p>
 * This is a <strong>stateless</strong> evaluator: it holds no per-metric
 * state and is safe to call concurrently for different metrics.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdEvaluator.class);

    /**
     * @param window     current and baseline samples; must contain at least one
     *                   current sample
     * @param definition the metric's configuration
     * @return the decision, possibly without breaches
     * @throws NullPointerException     if either argument is {@code null}
     * @throws IllegalArgumentException if the window belongs to another metric
     *                                  or has no current samples
     */
    public BreachDecision evaluate(MetricWindow window, MetricDefinition definition) {
        Objects.requireNonNull(window, "MetricWindow must not be null");
        Objects.requireNonNull(definition, "MetricDefinition must not be null");
        if (!window.getMetricId().equals(definition.id())) {
            throw new IllegalArgumentException("Window for '" + window.getMetricId()
                    + "' evaluated against definition '" + definition.id() + "'");
        }
        MetricSample latest = window.latestCurrent().orElseThrow(() -> new IllegalArgumentException(
                "Metric '" + definition.id() + "' has no current samples to evaluate"));

        double current = window.currentMean().orElseThrow();
        OptionalDouble baseline = window.baselineMean();

        List<Breach> breaches = new ArrayList<>();
        for (ThresholdCheck check : ThresholdChecks.forMode(definition.comparisonMode())) {
            check.check(current, baseline, definition).ifPresent(breaches::add);
        }

        BreachDecision decision = new BreachDecision(
                definition.id(),
                latest.getTimestamp(),
                current,
                baseline.isPresent() ? baseline.getAsDouble() : null,
                breaches);
        LOG.trace("Evaluated {}", decision);
        return decision;
    }
}
