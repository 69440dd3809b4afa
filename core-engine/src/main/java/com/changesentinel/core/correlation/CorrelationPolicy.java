package com.changesentinel.core.correlation;

import java.time.Duration;
import java.util.Objects;

/**
 * Scoring parameters for deployment correlation.
 *
 * <p>
 * {@code confidence = proximityWeight * proximity + categoryWeight * categoryScore},
 * clamped to {@code [0, 1]}, where
 * {@code proximity = floor + (1 - floor) * (1 - age / window)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationPolicy {

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(1);
    public static final double DEFAULT_PROXIMITY_FLOOR = 0.1;
    public static final double DEFAULT_PROXIMITY_WEIGHT = 0.7;
    public static final double DEFAULT_CATEGORY_WEIGHT = 0.3;

    private final Duration window;
    private final double proximityFloor;
    private final double proximityWeight;
    private final double categoryWeight;

    /**
     * @throws IllegalArgumentException if the window is not positive, the
     *                                  floor is outside {@code [0, 1]} or a
     *                                  weight is negative
     */
    public CorrelationPolicy(Duration window, double proximityFloor,
            double proximityWeight, double categoryWeight) {
        this.window = Objects.requireNonNull(window, "Correlation window must not be null");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Correlation window must be positive, got " + window);
        }
        if (proximityFloor < 0 || proximityFloor > 1) {
            throw new IllegalArgumentException("Proximity floor must be within [0, 1], got " + proximityFloor);
        }
        if (proximityWeight < 0 || categoryWeight < 0) {
            throw new IllegalArgumentException("Correlation weights must be >= 0");
        }
        this.proximityFloor = proximityFloor;
        this.proximityWeight = proximityWeight;
        this.categoryWeight = categoryWeight;
    }

    public static CorrelationPolicy defaults() {
        return new CorrelationPolicy(DEFAULT_WINDOW, DEFAULT_PROXIMITY_FLOOR,
                DEFAULT_PROXIMITY_WEIGHT, DEFAULT_CATEGORY_WEIGHT);
    }

    /**
     * @param age time between the deployment and the anomaly onset, within
     *            {@code [0, window]}
     * @return proximity in {@code [floor, 1]}
     */
    public double proximity(Duration age) {
        double ratio = (double) age.toMillis() / window.toMillis();
        ratio = Math.max(0.0, Math.min(1.0, ratio));
        return proximityFloor + (1.0 - proximityFloor) * (1.0 - ratio);
    }

    public double confidence(double proximity, double categoryScore) {
        double raw = proximityWeight * proximity + categoryWeight * categoryScore;
        return Math.max(0.0, Math.min(1.0, raw));
    }

    public Duration getWindow() {
        return window;
    }

    public double getProximityFloor() {
        return proximityFloor;
    }

    public double getProximityWeight() {
        return proximityWeight;
    }

    public double getCategoryWeight() {
        return categoryWeight;
    }

    @Override
    public String toString() {
        return "CorrelationPolicy{window=" + window + ", floor=" + proximityFloor
                + ", proximityWeight=" + proximityWeight + ", categoryWeight=" + categoryWeight + '}';
    }
}
