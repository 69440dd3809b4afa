package com.changesentinel.core.source;

import com.changesentinel.core.model.DegradationReason;

/**
 * A sample source or deployment feed could not answer. Transient: the
 * affected metric is skipped for the cycle and retried on the next one.
 *
 * @since 1.0.0
 */
public class SourceUnavailableException extends Exception {

    private static final long serialVersionUID = 1L;

    private final DegradationReason reason;

    public SourceUnavailableException(String message) {
        this(DegradationReason.UNAVAILABLE, message, null);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        this(DegradationReason.UNAVAILABLE, message, cause);
    }

    public SourceUnavailableException(DegradationReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason != null ? reason : DegradationReason.UNAVAILABLE;
    }

    public DegradationReason getReason() {
        return reason;
    }
}
