package com.changesentinel.core.model;

/**
 * Why a source was skipped for a cycle.
 */
public enum DegradationReason {

    /** The source reported itself unavailable. */
    UNAVAILABLE,

    /** A single fetch exceeded its timeout. */
    TIMEOUT,

    /** The fetch succeeded but the current window was empty. */
    NO_DATA,

    /** The cycle deadline passed before the metric finished. */
    DEADLINE_EXCEEDED,

    /** Unexpected failure while fetching or evaluating. */
    ERROR
}
