package com.changesentinel.core.config;

import com.changesentinel.core.model.InvalidMetricDefinitionException;
import com.changesentinel.core.model.MetricDefinition;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO for the sentinel YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * metrics:
 *   - scope: rds
 *     name: cpu.cluster-1
 *     unit: "%"
 *     comparison: both
 *     absoluteThreshold: 80
 *     percentageThreshold: 50
 *     direction: increase
 *     consecutivePoints: 2
 *     category: db-cpu
 * correlation:
 *   windowSeconds: 3600
 * cycle:
 *   maxConcurrentFetches: 8
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading, or use {@link #registry()}, which
 * validates the metric section while indexing it.
 * </p>
 *
 * @since 1.0.0
 */
public class SentinelConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<MetricDefinition> metrics = new ArrayList<>();
    private CorrelationSettings correlation = new CorrelationSettings();
    private CycleSettings cycle = new CycleSettings();

    /**
     * Validate every section, collecting all errors into one exception.
     *
     * @throws InvalidMetricDefinitionException if anything is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        try {
            MetricRegistry.of(metrics);
        } catch (InvalidMetricDefinitionException e) {
            errors.add(e.getMessage());
        }
        correlation.collectErrors(errors);
        cycle.collectErrors(errors);

        if (!errors.isEmpty()) {
            throw new InvalidMetricDefinitionException(
                    "Sentinel configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * @return a validated registry of the configured metrics
     * @throws InvalidMetricDefinitionException if any metric is invalid
     */
    public MetricRegistry registry() {
        return MetricRegistry.of(metrics);
    }

    /**
     * Return the metric list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of metric definitions
     */
    public List<MetricDefinition> getMetrics() {
        return Collections.unmodifiableList(metrics);
    }

    /**
     * Set the metric list (used by SnakeYAML during deserialization).
     *
     * @param metrics the metric definitions
     */
    public void setMetrics(List<MetricDefinition> metrics) {
        this.metrics = metrics != null ? new ArrayList<>(metrics) : new ArrayList<>();
    }

    public CorrelationSettings getCorrelation() {
        return correlation;
    }

    public void setCorrelation(CorrelationSettings correlation) {
        this.correlation = correlation != null ? correlation : new CorrelationSettings();
    }

    public CycleSettings getCycle() {
        return cycle;
    }

    public void setCycle(CycleSettings cycle) {
        this.cycle = cycle != null ? cycle : new CycleSettings();
    }

    @Override
    public String toString() {
        return "SentinelConfig{metrics=" + metrics.size()
                + ", correlation=" + correlation
                + ", cycle=" + cycle + '}';
    }
}
