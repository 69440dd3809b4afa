package com.changesentinel.core.detection;

import com.changesentinel.core.model.ComparisonMode;

import java.util.List;
import java.util.Objects;

/**
 * Factory that maps a {@link ComparisonMode} to the checks it runs.
 *
 * <p>
 * This is the single point of extension when adding a new kind of check:
 * implement {@link ThresholdCheck} and register it for the modes that should
 * run it. Checks are stateless, so shared instances are returned.
 * </p>
 *
 * @since 1.0.0
 */
public final class ThresholdChecks {

    private static final ThresholdCheck ABSOLUTE = new AbsoluteThresholdCheck();
    private static final ThresholdCheck PERCENTAGE_CHANGE = new PercentageChangeCheck();

    private ThresholdChecks() {
        // utility class - not instantiable
    }

    /**
     * @param mode comparison mode; must not be {@code null}
     * @return unmodifiable list of checks, absolute first
     */
    public static List<ThresholdCheck> forMode(ComparisonMode mode) {
        Objects.requireNonNull(mode, "ComparisonMode must not be null");
        return switch (mode) {
            case ABSOLUTE -> List.of(ABSOLUTE);
            case PERCENTAGE_CHANGE -> List.of(PERCENTAGE_CHANGE);
            case BOTH -> List.of(ABSOLUTE, PERCENTAGE_CHANGE);
        };
    }
}
