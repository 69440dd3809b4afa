package com.changesentinel.core.tracking;

import java.time.Instant;

/**
 * Immutable per-metric tracker entry. Replaced, never mutated, inside
 * {@code ConcurrentHashMap.compute}.
 */
final class BreachState {

    static final BreachState INITIAL = new BreachState(BreachStatus.NORMAL, 0, null, null);

    final BreachStatus status;
    final int consecutiveCount;
    final Instant onset;
    final Instant lastSeen;

    BreachState(BreachStatus status, int consecutiveCount, Instant onset, Instant lastSeen) {
        this.status = status;
        this.consecutiveCount = consecutiveCount;
        this.onset = onset;
        this.lastSeen = lastSeen;
    }

    /**
     * @return true if a decision observed at {@code observedAt} was already
     *         applied, or is older than one that was
     */
    boolean hasSeen(Instant observedAt) {
        return lastSeen != null && !observedAt.isAfter(lastSeen);
    }

    BreachState clean(Instant observedAt) {
        return new BreachState(BreachStatus.NORMAL, 0, null, observedAt);
    }

    BreachState breached(Instant observedAt, int required) {
        int count = consecutiveCount + 1;
        Instant streakOnset = consecutiveCount == 0 ? observedAt : onset;
        BreachStatus next = count >= required ? BreachStatus.CONFIRMED : BreachStatus.SUSPECT;
        return new BreachState(next, count, streakOnset, observedAt);
    }
}
