package com.changesentinel.core.model;

/**
 * Severity of a confirmed anomaly, graded by how far past its threshold the
 * breach went.
 */
public enum Severity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Grade a breach by its excess ratio {@code magnitude / threshold}.
     *
     * <ul>
     * <li>{@code < 0.1} - LOW</li>
     * <li>{@code < 0.5} - MEDIUM</li>
     * <li>{@code < 1.0} - HIGH</li>
     * <li>otherwise - CRITICAL</li>
     * </ul>
     *
     * A zero threshold has no scale, so any breach of it is CRITICAL.
     *
     * @param magnitude how far past the threshold, non-negative
     * @param threshold the threshold that was crossed, non-negative
     * @return the severity
     */
    public static Severity fromExcess(double magnitude, double threshold) {
        if (threshold <= 0) {
            return CRITICAL;
        }
        double ratio = magnitude / threshold;
        if (ratio < 0.1) {
            return LOW;
        }
        if (ratio < 0.5) {
            return MEDIUM;
        }
        if (ratio < 1.0) {
            return HIGH;
        }
        return CRITICAL;
    }
}
