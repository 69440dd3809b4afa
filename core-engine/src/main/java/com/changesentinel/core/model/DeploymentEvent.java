package com.changesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A change rolled out to some scope: the raw material for root-cause
 * hypotheses. Supplied by an external feed and never modified here.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DeploymentEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String scope;
    private final Instant timestamp;
    private final String version;
    private final String actor;
    private final CausationCategory category;

    /**
     * @param scope     service or resource that was deployed; required
     * @param timestamp when the deployment took effect; required
     * @param version   version label, may be {@code null}
     * @param actor     who or what deployed, may be {@code null}
     * @param category  kind of change; defaults to {@code deployment-generic}
     */
    @JsonCreator
    public DeploymentEvent(@JsonProperty("scope") String scope,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("version") String version,
            @JsonProperty("actor") String actor,
            @JsonProperty("category") CausationCategory category) {
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.version = version;
        this.actor = actor;
        this.category = category != null ? category : CausationCategory.DEPLOYMENT_GENERIC;
    }

    public DeploymentEvent(String scope, Instant timestamp, String version, String actor) {
        this(scope, timestamp, version, actor, null);
    }

    public String getScope() {
        return scope;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getVersion() {
        return version;
    }

    public String getActor() {
        return actor;
    }

    public CausationCategory getCategory() {
        return category;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DeploymentEvent that))
            return false;
        return scope.equals(that.scope)
                && timestamp.equals(that.timestamp)
                && Objects.equals(version, that.version)
                && Objects.equals(actor, that.actor)
                && category.equals(that.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scope, timestamp, version, actor, category);
    }

    @Override
    public String toString() {
        return "DeploymentEvent{" +
                "scope='" + scope + '\'' +
                ", timestamp=" + timestamp +
                ", version='" + version + '\'' +
                ", actor='" + actor + '\'' +
                ", category=" + category +
                '}';
    }
}
