package com.changesentinel.core.config;

import com.changesentinel.core.correlation.CausationTable;
import com.changesentinel.core.correlation.CorrelationPolicy;
import com.changesentinel.core.correlation.ScopeRelations;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code correlation:} section of the sentinel configuration.
 *
 * <pre>
 * correlation:
 *   windowSeconds: 3600
 *   proximityFloor: 0.1
 *   proximityWeight: 0.7
 *   categoryWeight: 0.3
 *   affinities:
 *     http-error: [db-cpu, cache-memory]
 *   relatedScopes:
 *     rds: [orders-api, billing-api]
 * </pre>
 */
public class CorrelationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private long windowSeconds = 3_600;
    private double proximityFloor = 0.1;
    private double proximityWeight = 0.7;
    private double categoryWeight = 0.3;
    private Map<String, List<String>> affinities = new LinkedHashMap<>();
    private Map<String, List<String>> relatedScopes = new LinkedHashMap<>();

    /**
     * @param errors receives one message per invalid value
     */
    void collectErrors(List<String> errors) {
        if (windowSeconds <= 0) {
            errors.add("correlation.windowSeconds must be > 0, got: " + windowSeconds);
        }
        if (proximityFloor < 0 || proximityFloor > 1) {
            errors.add("correlation.proximityFloor must be in [0, 1], got: " + proximityFloor);
        }
        if (proximityWeight < 0 || categoryWeight < 0 || proximityWeight + categoryWeight <= 0) {
            errors.add("correlation weights must be >= 0 with a positive sum, got: "
                    + proximityWeight + " / " + categoryWeight);
        }
        try {
            toCausationTable();
        } catch (IllegalArgumentException e) {
            errors.add("correlation.affinities: " + e.getMessage());
        }
    }

    public Duration window() {
        return Duration.ofSeconds(windowSeconds);
    }

    public CorrelationPolicy toPolicy() {
        return new CorrelationPolicy(window(), proximityFloor, proximityWeight, categoryWeight);
    }

    public CausationTable toCausationTable() {
        CausationTable.Builder builder = CausationTable.builder();
        affinities.forEach((category, related) -> related.forEach(r -> builder.affinity(category, r)));
        return builder.build();
    }

    public ScopeRelations toScopeRelations() {
        ScopeRelations.Builder builder = ScopeRelations.builder();
        relatedScopes.forEach((scope, related) -> related.forEach(r -> builder.relate(scope, r)));
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public long getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(long windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public double getProximityFloor() {
        return proximityFloor;
    }

    public void setProximityFloor(double proximityFloor) {
        this.proximityFloor = proximityFloor;
    }

    public double getProximityWeight() {
        return proximityWeight;
    }

    public void setProximityWeight(double proximityWeight) {
        this.proximityWeight = proximityWeight;
    }

    public double getCategoryWeight() {
        return categoryWeight;
    }

    public void setCategoryWeight(double categoryWeight) {
        this.categoryWeight = categoryWeight;
    }

    public Map<String, List<String>> getAffinities() {
        return affinities;
    }

    public void setAffinities(Map<String, List<String>> affinities) {
        this.affinities = copy(affinities);
    }

    public Map<String, List<String>> getRelatedScopes() {
        return relatedScopes;
    }

    public void setRelatedScopes(Map<String, List<String>> relatedScopes) {
        this.relatedScopes = copy(relatedScopes);
    }

    private static Map<String, List<String>> copy(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((k, v) -> copy.put(k, v != null ? new ArrayList<>(v) : new ArrayList<>()));
        }
        return copy;
    }

    @Override
    public String toString() {
        return "CorrelationSettings{" +
                "windowSeconds=" + windowSeconds +
                ", proximityFloor=" + proximityFloor +
                ", proximityWeight=" + proximityWeight +
                ", categoryWeight=" + categoryWeight +
                ", affinities=" + affinities +
                ", relatedScopes=" + relatedScopes +
                '}';
    }
}
