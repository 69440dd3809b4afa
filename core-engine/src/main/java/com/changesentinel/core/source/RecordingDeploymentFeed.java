package com.changesentinel.core.source;

import com.changesentinel.core.correlation.ScopeRelations;
import com.changesentinel.core.model.DeploymentEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded in-memory {@link DeploymentFeed} filled by pushes, e.g. from a CI
 * webhook. The oldest events are evicted once the capacity is reached.
 *
 * <p>
 * Thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class RecordingDeploymentFeed implements DeploymentFeed {

    private static final Logger LOG = LoggerFactory.getLogger(RecordingDeploymentFeed.class);

    public static final int DEFAULT_CAPACITY = 1_000;

    private final int capacity;
    private final Deque<DeploymentEvent> events = new ArrayDeque<>();

    public RecordingDeploymentFeed() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @throws IllegalArgumentException if {@code capacity < 1}
     */
    public RecordingDeploymentFeed(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Store one deployment.
     */
    public void record(DeploymentEvent event) {
        Objects.requireNonNull(event, "DeploymentEvent must not be null");
        synchronized (events) {
            if (events.size() == capacity) {
                DeploymentEvent evicted = events.removeFirst();
                LOG.debug("Deployment feed full, evicted {}", evicted);
            }
            events.addLast(event);
        }
        LOG.info("Deployment recorded: scope={} version={} actor={} at {}",
                event.getScope(), event.getVersion(), event.getActor(), event.getTimestamp());
    }

    @Override
    public List<DeploymentEvent> fetchDeploymentEvents(String scope, Instant since) {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(since, "since must not be null");
        boolean any = ScopeRelations.ANY.equals(scope);
        synchronized (events) {
            return events.stream()
                    .filter(e -> any || e.getScope().equals(scope))
                    .filter(e -> !e.getTimestamp().isBefore(since))
                    .toList();
        }
    }

    public int size() {
        synchronized (events) {
            return events.size();
        }
    }
}
