package com.changesentinel.core.tracking;

/**
 * Hysteresis state of one metric.
 */
public enum BreachStatus {

    /** No breach in the latest evaluation. */
    NORMAL,

    /** Breaching, but fewer consecutive evaluations than required. */
    SUSPECT,

    /** Breach confirmed; a signal was emitted when this state was entered. */
    CONFIRMED
}
