package com.changesentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Describes a single monitored metric and the thresholds it is held to.
 *
 * <p>
 * Identity is {@code scope + "." + name}: the scope is the service or
 * resource the metric belongs to (e.g. {@code rds}), the name identifies the
 * measurement within it (e.g. {@code cpu.cluster-1}).
 * </p>
 *
 * <p>
 * Supported comparison modes:
 * </p>
 * <ul>
 * <li>{@code absolute} - the current value against a fixed ceiling (or floor
 * for {@code decrease})</li>
 * <li>{@code percentage_change} - the current value against the baseline
 * window, as a percentage</li>
 * <li>{@code both} - either check fires independently</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that thresholds, hysteresis and windows are legal.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Pattern SCOPE_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");

    /** Service or resource the metric belongs to. No dots. */
    private String scope;

    /** Measurement name within the scope. */
    private String name;

    /** Display unit, e.g. "%", "count", "bytes". */
    private String unit = "";

    /** Comparison mode: "absolute", "percentage_change" or "both". */
    private String comparison = "absolute";

    /** Ceiling (or floor) for the absolute check. Required by "absolute" and "both". */
    private Double absoluteThreshold;

    /** Percentage-change threshold for the relative check. Required by "percentage_change" and "both". */
    private Double percentageThreshold;

    /** Direction of badness: "increase", "decrease" or "either". */
    private String direction = "increase";

    /** Consecutive breaching cycles required before a signal is confirmed. */
    private int consecutivePoints = 1;

    /** Offset of the baseline window behind the current window. */
    private long baselineLookbackSeconds = 604_800;

    /** Length of the current (and baseline) window. */
    private long windowSeconds = 3_600;

    /** Expected causation category of a breach on this metric. */
    private String category = CausationCategory.DEPLOYMENT_GENERIC.name();

    /** The relative check only applies when traffic volume exceeds this floor. */
    private double minimumValue;

    /** Source-specific query, e.g. a PromQL expression. Optional. */
    private String query;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate identity, thresholds, hysteresis and windows.
     *
     * @throws InvalidMetricDefinitionException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        String label = describe();

        if (scope == null || scope.isBlank()) {
            errors.add("Metric 'scope' is required");
        } else if (!SCOPE_PATTERN.matcher(scope).matches()) {
            errors.add("Metric '" + label + "' has malformed scope '" + scope
                    + "' (expected letters, digits, '_' or '-')");
        }
        if (name == null || name.isBlank()) {
            errors.add("Metric 'name' is required");
        }
        if (absoluteThreshold != null && absoluteThreshold < 0) {
            errors.add("Metric '" + label + "' requires 'absoluteThreshold' >= 0");
        }
        if (percentageThreshold != null && percentageThreshold < 0) {
            errors.add("Metric '" + label + "' requires 'percentageThreshold' >= 0");
        }
        if (minimumValue < 0) {
            errors.add("Metric '" + label + "' requires 'minimumValue' >= 0");
        }
        if (consecutivePoints < 1) {
            errors.add("Metric '" + label + "' requires 'consecutivePoints' >= 1");
        }
        if (windowSeconds <= 0) {
            errors.add("Metric '" + label + "' requires 'windowSeconds' > 0");
        }
        if (baselineLookbackSeconds <= 0) {
            errors.add("Metric '" + label + "' requires 'baselineLookbackSeconds' > 0");
        }
        try {
            ComparisonMode mode = ComparisonMode.fromString(comparison);
            if (mode.includesAbsolute() && absoluteThreshold == null) {
                errors.add("Metric '" + label + "' with comparison '" + comparison
                        + "' requires 'absoluteThreshold'");
            }
            if (mode.includesRelative() && percentageThreshold == null) {
                errors.add("Metric '" + label + "' with comparison '" + comparison
                        + "' requires 'percentageThreshold'");
            }
        } catch (IllegalArgumentException e) {
            errors.add("Metric '" + label + "': " + e.getMessage());
        }
        try {
            Direction.fromString(direction);
        } catch (IllegalArgumentException e) {
            errors.add("Metric '" + label + "': " + e.getMessage());
        }
        try {
            CausationCategory.of(category);
        } catch (IllegalArgumentException e) {
            errors.add("Metric '" + label + "': " + e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new InvalidMetricDefinitionException(
                    "Invalid MetricDefinition: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Typed views
    // ---------------------------------------------------------------

    /**
     * @return the metric identity, {@code scope.name}
     */
    public String id() {
        return scope + "." + name;
    }

    public ComparisonMode comparisonMode() {
        return ComparisonMode.fromString(comparison);
    }

    public Direction badDirection() {
        return Direction.fromString(direction);
    }

    public CausationCategory causationCategory() {
        return CausationCategory.of(category);
    }

    public Duration window() {
        return Duration.ofSeconds(windowSeconds);
    }

    public Duration baselineLookback() {
        return Duration.ofSeconds(baselineLookbackSeconds);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getScope() {
        return scope;
    }

    public void setScope(String scope) {
        this.scope = scope;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUnit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit != null ? unit : "";
    }

    public String getComparison() {
        return comparison;
    }

    /**
     * Set the comparison mode, normalised to lowercase.
     *
     * @param comparison comparison mode string
     */
    public void setComparison(String comparison) {
        this.comparison = comparison != null ? comparison.toLowerCase(Locale.ROOT) : null;
    }

    /**
     * @return the absolute threshold, {@code null} when not configured
     */
    public Double getAbsoluteThreshold() {
        return absoluteThreshold;
    }

    public void setAbsoluteThreshold(Double absoluteThreshold) {
        this.absoluteThreshold = absoluteThreshold;
    }

    /**
     * @return the percentage threshold, {@code null} when not configured
     */
    public Double getPercentageThreshold() {
        return percentageThreshold;
    }

    public void setPercentageThreshold(Double percentageThreshold) {
        this.percentageThreshold = percentageThreshold;
    }

    public String getDirection() {
        return direction;
    }

    public void setDirection(String direction) {
        this.direction = direction != null ? direction.toLowerCase(Locale.ROOT) : null;
    }

    public int getConsecutivePoints() {
        return consecutivePoints;
    }

    public void setConsecutivePoints(int consecutivePoints) {
        this.consecutivePoints = consecutivePoints;
    }

    public long getBaselineLookbackSeconds() {
        return baselineLookbackSeconds;
    }

    public void setBaselineLookbackSeconds(long baselineLookbackSeconds) {
        this.baselineLookbackSeconds = baselineLookbackSeconds;
    }

    public long getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(long windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category != null ? category.toLowerCase(Locale.ROOT) : null;
    }

    public double getMinimumValue() {
        return minimumValue;
    }

    public void setMinimumValue(double minimumValue) {
        this.minimumValue = minimumValue;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    private String describe() {
        return (scope != null ? scope : "?") + "." + (name != null ? name : "?");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricDefinition that))
            return false;
        return Objects.equals(scope, that.scope) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scope, name);
    }

    @Override
    public String toString() {
        return "MetricDefinition{" +
                "id='" + describe() + '\'' +
                ", comparison='" + comparison + '\'' +
                ", absoluteThreshold=" + absoluteThreshold +
                ", percentageThreshold=" + percentageThreshold +
                ", direction='" + direction + '\'' +
                ", consecutivePoints=" + consecutivePoints +
                ", windowSeconds=" + windowSeconds +
                ", baselineLookbackSeconds=" + baselineLookbackSeconds +
                ", category='" + category + '\'' +
                '}';
    }
}
