package com.changesentinel.core.correlation;

import com.changesentinel.core.model.CausationCategory;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * How well a deployment's category explains a signal's category.
 *
 * <ul>
 * <li>same category: {@value #EXACT}</li>
 * <li>configured affinity (symmetric): {@value #AFFINITY}</li>
 * <li>generic deployment: {@value #GENERIC}</li>
 * <li>anything else: {@value #UNRELATED}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class CausationTable {

    public static final double EXACT = 1.0;
    public static final double AFFINITY = 0.6;
    public static final double GENERIC = 0.4;
    public static final double UNRELATED = 0.0;

    private final Map<CausationCategory, Set<CausationCategory>> affinities;

    private CausationTable(Map<CausationCategory, Set<CausationCategory>> affinities) {
        Map<CausationCategory, Set<CausationCategory>> copy = new HashMap<>();
        affinities.forEach((k, v) -> copy.put(k, Set.copyOf(v)));
        this.affinities = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a table without affinities
     */
    public static CausationTable defaults() {
        return builder().build();
    }

    /**
     * @param expected   the signal's category
     * @param deployment the deployment's category
     * @return the category score
     */
    public double score(CausationCategory expected, CausationCategory deployment) {
        Objects.requireNonNull(expected, "expected category must not be null");
        Objects.requireNonNull(deployment, "deployment category must not be null");
        if (expected.equals(deployment)) {
            return EXACT;
        }
        if (affinities.getOrDefault(expected, Set.of()).contains(deployment)) {
            return AFFINITY;
        }
        if (deployment.isGeneric()) {
            return GENERIC;
        }
        return UNRELATED;
    }

    public boolean isExactMatch(CausationCategory expected, CausationCategory deployment) {
        return expected.equals(deployment);
    }

    @Override
    public String toString() {
        return "CausationTable{affinities=" + affinities + '}';
    }

    /**
     * Builder for {@link CausationTable}. Affinities are recorded in both
     * directions.
     */
    public static final class Builder {
        private final Map<CausationCategory, Set<CausationCategory>> affinities = new HashMap<>();

        public Builder affinity(CausationCategory a, CausationCategory b) {
            Objects.requireNonNull(a, "category must not be null");
            Objects.requireNonNull(b, "category must not be null");
            affinities.computeIfAbsent(a, k -> new HashSet<>()).add(b);
            affinities.computeIfAbsent(b, k -> new HashSet<>()).add(a);
            return this;
        }

        /**
         * @throws IllegalArgumentException if either tag is malformed
         */
        public Builder affinity(String a, String b) {
            return affinity(CausationCategory.of(a), CausationCategory.of(b));
        }

        public CausationTable build() {
            return new CausationTable(affinities);
        }
    }
}
