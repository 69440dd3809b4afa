package com.changesentinel.core.model;

/**
 * Thrown at configuration time when a metric definition (or the set of
 * definitions) is not usable. Never thrown once cycles are running.
 */
public class InvalidMetricDefinitionException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public InvalidMetricDefinitionException(String message) {
        super(message);
    }
}
