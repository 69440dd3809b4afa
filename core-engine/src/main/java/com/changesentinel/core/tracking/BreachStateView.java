package com.changesentinel.core.tracking;

import java.time.Instant;
import java.util.Optional;

/**
 * Read-only snapshot of one metric's tracker entry.
 *
 * @since 1.0.0
 */
public final class BreachStateView {

    private final String metricId;
    private final BreachStatus status;
    private final int consecutiveCount;
    private final Instant onset;
    private final Instant lastSeen;

    BreachStateView(String metricId, BreachState state) {
        this.metricId = metricId;
        this.status = state.status;
        this.consecutiveCount = state.consecutiveCount;
        this.onset = state.onset;
        this.lastSeen = state.lastSeen;
    }

    public String getMetricId() {
        return metricId;
    }

    public BreachStatus getStatus() {
        return status;
    }

    public int getConsecutiveCount() {
        return consecutiveCount;
    }

    /**
     * @return observation time of the first breach in the current streak,
     *         empty when {@link BreachStatus#NORMAL}
     */
    public Optional<Instant> getOnset() {
        return Optional.ofNullable(onset);
    }

    public Optional<Instant> getLastSeen() {
        return Optional.ofNullable(lastSeen);
    }

    @Override
    public String toString() {
        return "BreachStateView{" + metricId + " " + status + " x" + consecutiveCount
                + ", onset=" + onset + ", lastSeen=" + lastSeen + '}';
    }
}
