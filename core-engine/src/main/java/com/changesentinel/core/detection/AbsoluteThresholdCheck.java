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
 * Absolute threshold check.
 *
 * <p>
 * Compares the current value with {@code absoluteThreshold}. For
 * {@code increase} the threshold is a ceiling: the check fires when
 * {@code current - threshold >= 0}. For {@code decrease} it is a floor and
 * fires when {@code threshold - current >= 0}. A level has no natural
 * "either" reading, so {@code either} uses the ceiling.
 * </p>
 *
 * <p>
 * The baseline is ignored.
 * </p>
 *
 * @since 1.0.0
 */
public final class AbsoluteThresholdCheck implements ThresholdCheck {

    private static final Logger LOG = LoggerFactory.getLogger(AbsoluteThresholdCheck.class);

    @Override
    public Optional<Breach> check(double current, OptionalDouble baseline, MetricDefinition definition) {
        double threshold = Objects.requireNonNull(definition.getAbsoluteThreshold(),
                "absoluteThreshold is not configured for " + definition.id());
        double magnitude = switch (definition.badDirection()) {
            case DECREASE -> threshold - current;
            case INCREASE, EITHER -> current - threshold;
        };

        if (magnitude >= 0) {
            LOG.debug("Metric [{}] absolute breach: value={} threshold={} direction={}",
                    definition.id(), current, threshold, definition.badDirection());
            return Optional.of(new Breach(BreachType.ABSOLUTE, current, threshold, magnitude));
        }
        return Optional.empty();
    }

    @Override
    public BreachType type() {
        return BreachType.ABSOLUTE;
    }
}
