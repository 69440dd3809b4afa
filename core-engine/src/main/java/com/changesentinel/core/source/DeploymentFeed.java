package com.changesentinel.core.source;

import com.changesentinel.core.model.DeploymentEvent;

import java.time.Instant;
import java.util.List;

/**
 * Supplier of deployment events.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface DeploymentFeed {

    /** A feed that never reports deployments. */
    DeploymentFeed NONE = (scope, since) -> List.of();

    /**
     * @param scope deployed scope, or {@code "*"} for every scope
     * @param since inclusive lower bound
     * @return deployments of the scope at or after {@code since}
     * @throws SourceUnavailableException if the feed cannot answer
     */
    List<DeploymentEvent> fetchDeploymentEvents(String scope, Instant since)
            throws SourceUnavailableException;
}
