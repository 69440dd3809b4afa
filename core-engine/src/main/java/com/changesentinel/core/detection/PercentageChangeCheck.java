package com.changesentinel.core.detection;

import com.changesentinel.core.model.Breach;
import com.changesentinel.core.model.BreachType;
import com.changesentinel.core.model.MetricDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Percentage-change check against the baseline window.
 *
 * <p>
 * {@code pct = (current - baseline) / baseline * 100}. The check fires when
 * {@code pct >= threshold} for {@code increase}, {@code -pct >= threshold}
 * for {@code decrease} and {@code |pct| >= threshold} for {@code either}.
 * </p>
 *
 * <h3>Skipped evaluations</h3>
 * <ul>
 * <li>No baseline, or a baseline of exactly zero: there is nothing to divide
 * by, so the check is skipped and logged rather than reported as a
 * breach.</li>
 * <li>Traffic at or below a positive {@code minimumValue}: low-volume series
 * swing by large percentages without meaning anything. The floor is tested
 * against the value the bad direction starts from: the current value for
 * {@code increase}, the baseline for {@code decrease} (a collapse drives the
 * current value under the floor) and the larger of the two for
 * {@code either}.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class PercentageChangeCheck implements ThresholdCheck {

    private static final Logger LOG = LoggerFactory.getLogger(PercentageChangeCheck.class);

    @Override
    public Optional<Breach> check(double current, OptionalDouble baseline, MetricDefinition definition) {
        if (baseline.isEmpty() || baseline.getAsDouble() == 0) {
            LOG.info("Metric [{}]: insufficient baseline ({}) - relative check skipped",
                    definition.id(), baseline.isEmpty() ? "absent" : "zero");
            return Optional.empty();
        }
        double base = baseline.getAsDouble();
        double minimum = definition.getMinimumValue();
        if (minimum > 0) {
            double volume = switch (definition.badDirection()) {
                case INCREASE -> current;
                case DECREASE -> base;
                case EITHER -> Math.max(current, base);
            };
            if (volume <= minimum) {
                LOG.trace("Metric [{}]: volume {} at or below minimum {} - relative check skipped",
                        definition.id(), volume, minimum);
                return Optional.empty();
            }
        }

        double pct = (current - base) / base * 100.0;
        double threshold = Objects.requireNonNull(definition.getPercentageThreshold(),
                "percentageThreshold is not configured for " + definition.id());
        double magnitude = switch (definition.badDirection()) {
            case INCREASE -> pct - threshold;
            case DECREASE -> -pct - threshold;
            case EITHER -> Math.abs(pct) - threshold;
        };

        if (magnitude >= 0) {
            LOG.debug("Metric [{}] relative breach: change={}% threshold={}% (current={}, baseline={})",
                    definition.id(), String.format("%.2f", pct), threshold, current, base);
            return Optional.of(new Breach(BreachType.RELATIVE, pct, threshold, magnitude));
        }
        return Optional.empty();
    }

    @Override
    public BreachType type() {
        return BreachType.RELATIVE;
    }
}
