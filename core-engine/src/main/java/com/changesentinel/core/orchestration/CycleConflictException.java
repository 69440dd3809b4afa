package com.changesentinel.core.orchestration;

/**
 * Thrown when a cycle is triggered while another one is still running.
 * Triggers are rejected, never queued.
 *
 * @since 1.0.0
 */
public class CycleConflictException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public CycleConflictException(String message) {
        super(message);
    }
}
