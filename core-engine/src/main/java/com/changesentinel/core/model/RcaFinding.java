package com.changesentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * Root-cause hypothesis for one signal: the correlated deployments ranked by
 * confidence, the first being the primary hypothesis.
 *
 * @since 1.0.0
 */
public final class RcaFinding implements Serializable {

    private static final long serialVersionUID = 1L;

    private final AnomalySignal signal;
    private final List<RankedDeployment> candidates;
    private final CausationCategory category;

    /**
     * @param signal     the attributed signal
     * @param candidates ranked candidates, best first; must not be empty
     * @param category   causation category of the hypothesis
     */
    public RcaFinding(AnomalySignal signal, List<RankedDeployment> candidates,
            CausationCategory category) {
        this.signal = Objects.requireNonNull(signal, "signal must not be null");
        Objects.requireNonNull(candidates, "candidates must not be null");
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("A finding needs at least one candidate deployment");
        }
        this.candidates = List.copyOf(candidates);
        this.category = Objects.requireNonNull(category, "category must not be null");
    }

    public AnomalySignal getSignal() {
        return signal;
    }

    public List<RankedDeployment> getCandidates() {
        return candidates;
    }

    public RankedDeployment getPrimary() {
        return candidates.get(0);
    }

    /**
     * @return the primary candidate's confidence
     */
    public double getConfidence() {
        return getPrimary().getConfidence();
    }

    public CausationCategory getCategory() {
        return category;
    }

    @Override
    public String toString() {
        return "RcaFinding{" + signal.getMetricId() + " <- " + getPrimary()
                + ", category=" + category + ", candidates=" + candidates.size() + '}';
    }
}
