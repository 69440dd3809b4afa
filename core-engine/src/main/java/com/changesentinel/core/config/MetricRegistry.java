package com.changesentinel.core.config;

import com.changesentinel.core.model.InvalidMetricDefinitionException;
import com.changesentinel.core.model.MetricDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed, validated set of metric definitions keyed by identity.
 *
 * <p>
 * Built once at startup by {@link #of(List)}, which validates every
 * definition and rejects duplicate identities. Iteration order is the
 * configuration order.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricRegistry {

    private final Map<String, MetricDefinition> definitions;

    private MetricRegistry(Map<String, MetricDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    /**
     * Validate and index the given definitions.
     *
     * <p>
     * Collects every error and throws a single exception listing all of them.
     * </p>
     *
     * @param metrics definitions; must not be {@code null}
     * @return the registry
     * @throws InvalidMetricDefinitionException if any definition is invalid or
     *                                          two share an identity
     */
    public static MetricRegistry of(List<MetricDefinition> metrics) {
        Objects.requireNonNull(metrics, "Metric definitions must not be null");
        List<String> errors = new ArrayList<>();
        Map<String, MetricDefinition> byId = new LinkedHashMap<>();

        for (int i = 0; i < metrics.size(); i++) {
            MetricDefinition metric = metrics.get(i);
            if (metric == null) {
                errors.add("Metric at index " + i + " is null");
                continue;
            }
            try {
                metric.validate();
            } catch (InvalidMetricDefinitionException e) {
                errors.add(e.getMessage());
                continue;
            }
            if (byId.putIfAbsent(metric.id(), metric) != null) {
                errors.add("Duplicate metric identity '" + metric.id() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidMetricDefinitionException(
                    "Metric configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
        return new MetricRegistry(byId);
    }

    public Optional<MetricDefinition> find(String metricId) {
        return Optional.ofNullable(definitions.get(metricId));
    }

    public Collection<MetricDefinition> all() {
        return definitions.values();
    }

    public int size() {
        return definitions.size();
    }

    public boolean isEmpty() {
        return definitions.isEmpty();
    }

    @Override
    public String toString() {
        return "MetricRegistry" + definitions.keySet();
    }
}
