package com.changesentinel.core.model;

/**
 * Which check produced a breach.
 */
public enum BreachType {

    /** The current value crossed the absolute threshold. */
    ABSOLUTE,

    /** The percentage change against the baseline crossed its threshold. */
    RELATIVE
}
