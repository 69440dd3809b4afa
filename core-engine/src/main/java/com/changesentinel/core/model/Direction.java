package com.changesentinel.core.model;

import java.util.Locale;

/**
 * Direction in which a metric moving is considered bad.
 */
public enum Direction {

    INCREASE,
    DECREASE,
    EITHER;

    /**
     * @param value configuration string, case-insensitive
     * @return the matching direction
     * @throws IllegalArgumentException if {@code value} is null or unknown
     */
    public static Direction fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("direction is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "increase" -> INCREASE;
            case "decrease" -> DECREASE;
            case "either" -> EITHER;
            default -> throw new IllegalArgumentException("Unknown direction: '" + value
                    + "'. Supported: increase, decrease, either");
        };
    }
}
