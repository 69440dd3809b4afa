package com.changesentinel.core.model;

/**
 * What started an evaluation cycle.
 */
public enum CycleTrigger {

    /** Fixed-interval clock. */
    SCHEDULED,

    /** External request (HTTP, operator command). */
    ON_DEMAND
}
