package com.changesentinel.core.detection;

import com.changesentinel.core.model.Breach;
import com.changesentinel.core.model.BreachType;
import com.changesentinel.core.model.MetricDefinition;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Contract for a single threshold check.
 * <p>
 * Implementations are <strong>stateless</strong> and thread-safe: every
 * input arrives as an argument, so one instance serves every metric and may
 * be called concurrently.
 * </p>
 */
public interface ThresholdCheck {

    /**
     * Decide whether the current value breaches the definition's threshold.
     *
     * @param current    representative value of the current window
     * @param baseline   representative value of the baseline window, if any
     * @param definition the metric's configuration
     * @return a {@link Breach} if the check fires, empty otherwise
     */
    Optional<Breach> check(double current, OptionalDouble baseline, MetricDefinition definition);

    /**
     * @return the breach type this check produces
     */
    BreachType type();
}
