package com.changesentinel.core.model;

import java.util.Locale;

/**
 * Which threshold checks apply to a metric.
 */
public enum ComparisonMode {

    ABSOLUTE,
    PERCENTAGE_CHANGE,
    BOTH;

    /**
     * Parse a configuration value. Accepts {@code percentage_change},
     * {@code percentage-change} and {@code percentagechange} alike.
     *
     * @param value configuration string
     * @return the matching mode
     * @throws IllegalArgumentException if {@code value} is null or unknown
     */
    public static ComparisonMode fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("comparison mode is required");
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (normalised) {
            case "absolute" -> ABSOLUTE;
            case "percentage_change", "percentagechange", "relative" -> PERCENTAGE_CHANGE;
            case "both" -> BOTH;
            default -> throw new IllegalArgumentException("Unknown comparison mode: '" + value
                    + "'. Supported: absolute, percentage_change, both");
        };
    }

    public boolean includesAbsolute() {
        return this != PERCENTAGE_CHANGE;
    }

    public boolean includesRelative() {
        return this != ABSOLUTE;
    }
}
