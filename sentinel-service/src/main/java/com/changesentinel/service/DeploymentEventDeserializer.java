package com.changesentinel.service;

import com.changesentinel.core.model.DeploymentEvent;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts a deployment webhook body into a {@link DeploymentEvent}.
 * <p>
 * Malformed payloads are logged and dropped (returns {@code null}), so a
 * misconfigured CI job cannot break the feed.
 * </p>
 */
public class DeploymentEventDeserializer {

    private static final Logger LOG = LoggerFactory.getLogger(DeploymentEventDeserializer.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * @param body raw request body
     * @return the event, or {@code null} if the body is empty or malformed
     */
    public DeploymentEvent deserialize(byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        try {
            return mapper.readValue(body, DeploymentEvent.class);
        } catch (Exception e) {
            LOG.warn("Failed to deserialize deployment event - skipping: {}", e.getMessage());
            return null;
        }
    }
}
