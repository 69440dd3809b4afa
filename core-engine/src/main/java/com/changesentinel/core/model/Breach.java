package com.changesentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * One fired check within a {@link BreachDecision}.
 *
 * <p>
 * {@code observed} is what the check compared: the current value for
 * {@link BreachType#ABSOLUTE}, the percentage change for
 * {@link BreachType#RELATIVE}. {@code magnitude} is how far past the
 * threshold it went, in the same unit.
 * </p>
 */
public final class Breach implements Serializable {

    private static final long serialVersionUID = 1L;

    private final BreachType type;
    private final double observed;
    private final double threshold;
    private final double magnitude;

    public Breach(BreachType type, double observed, double threshold, double magnitude) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.observed = observed;
        this.threshold = threshold;
        this.magnitude = magnitude;
    }

    public BreachType getType() {
        return type;
    }

    public double getObserved() {
        return observed;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getMagnitude() {
        return magnitude;
    }

    /**
     * @return magnitude relative to the threshold; infinite for a zero threshold
     */
    public double excessRatio() {
        return threshold > 0 ? magnitude / threshold : Double.POSITIVE_INFINITY;
    }

    public Severity severity() {
        return Severity.fromExcess(magnitude, threshold);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Breach that))
            return false;
        return type == that.type
                && Double.compare(observed, that.observed) == 0
                && Double.compare(threshold, that.threshold) == 0
                && Double.compare(magnitude, that.magnitude) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, observed, threshold, magnitude);
    }

    @Override
    public String toString() {
        return "Breach{" + type + ", observed=" + observed + ", threshold=" + threshold
                + ", magnitude=" + magnitude + '}';
    }
}
