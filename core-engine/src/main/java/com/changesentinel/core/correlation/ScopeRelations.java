package com.changesentinel.core.correlation;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Which deployment scopes may explain anomalies in another scope.
 *
 * <p>
 * A scope is always related to itself. Relations are directional: relating
 * {@code rds} to {@code orders-api} lets an {@code orders-api} deployment
 * explain an {@code rds} anomaly, not the reverse. Relating a scope to
 * {@value #ANY} lets deployments of every scope explain it.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScopeRelations {

    /** Wildcard scope. Deployment feeds treat it as "all scopes". */
    public static final String ANY = "*";

    private final Map<String, Set<String>> related;

    private ScopeRelations(Map<String, Set<String>> related) {
        Map<String, Set<String>> copy = new HashMap<>();
        related.forEach((k, v) -> copy.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        this.related = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return relations where every scope is only related to itself
     */
    public static ScopeRelations none() {
        return builder().build();
    }

    /**
     * @param signalScope     the anomalous scope
     * @param deploymentScope the deployed scope
     * @return true if a deployment of {@code deploymentScope} may explain an
     *         anomaly in {@code signalScope}
     */
    public boolean matches(String signalScope, String deploymentScope) {
        if (Objects.equals(signalScope, deploymentScope)) {
            return true;
        }
        Set<String> set = related.getOrDefault(signalScope, Set.of());
        return set.contains(ANY) || set.contains(deploymentScope);
    }

    /**
     * @param scope the anomalous scope
     * @return the scope itself followed by its related scopes, possibly
     *         including {@value #ANY}
     */
    public Set<String> scopesFor(String scope) {
        Set<String> scopes = new LinkedHashSet<>();
        scopes.add(scope);
        scopes.addAll(related.getOrDefault(scope, Set.of()));
        return scopes;
    }

    @Override
    public String toString() {
        return "ScopeRelations{" + related + '}';
    }

    /**
     * Builder for {@link ScopeRelations}.
     */
    public static final class Builder {
        private final Map<String, Set<String>> related = new HashMap<>();

        /**
         * @param scope   the anomalous scope
         * @param related a scope whose deployments may explain it, or
         *                {@value ScopeRelations#ANY}
         */
        public Builder relate(String scope, String related) {
            Objects.requireNonNull(scope, "scope must not be null");
            Objects.requireNonNull(related, "related scope must not be null");
            this.related.computeIfAbsent(scope, k -> new LinkedHashSet<>()).add(related);
            return this;
        }

        public ScopeRelations build() {
            return new ScopeRelations(related);
        }
    }
}
