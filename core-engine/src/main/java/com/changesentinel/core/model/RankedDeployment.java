package com.changesentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A deployment considered as the cause of one signal, with its score.
 */
public final class RankedDeployment implements Serializable {

    private static final long serialVersionUID = 1L;

    private final DeploymentEvent deployment;
    private final double confidence;
    private final double proximity;
    private final double categoryScore;

    public RankedDeployment(DeploymentEvent deployment, double confidence,
            double proximity, double categoryScore) {
        this.deployment = Objects.requireNonNull(deployment, "deployment must not be null");
        this.confidence = confidence;
        this.proximity = proximity;
        this.categoryScore = categoryScore;
    }

    public DeploymentEvent getDeployment() {
        return deployment;
    }

    /**
     * @return combined score in [0, 1]
     */
    public double getConfidence() {
        return confidence;
    }

    public double getProximity() {
        return proximity;
    }

    public double getCategoryScore() {
        return categoryScore;
    }

    @Override
    public String toString() {
        return "RankedDeployment{" + deployment.getScope() + "@" + deployment.getVersion()
                + ", confidence=" + String.format("%.3f", confidence) + '}';
    }
}
