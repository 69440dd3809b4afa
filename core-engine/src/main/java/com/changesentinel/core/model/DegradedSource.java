package com.changesentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A source skipped for one cycle, and why.
 *
 * <p>
 * {@code sourceId} is a metric identity, or {@code deployments:<scope>} for
 * the deployment feed.
 * </p>
 */
public final class DegradedSource implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String sourceId;
    private final String scope;
    private final DegradationReason reason;
    private final String message;

    public DegradedSource(String sourceId, String scope, DegradationReason reason, String message) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
        this.scope = scope;
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.message = message;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getScope() {
        return scope;
    }

    public DegradationReason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DegradedSource that))
            return false;
        return sourceId.equals(that.sourceId) && reason == that.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, reason);
    }

    @Override
    public String toString() {
        return "DegradedSource{" + sourceId + ", " + reason + ", '" + message + "'}";
    }
}
