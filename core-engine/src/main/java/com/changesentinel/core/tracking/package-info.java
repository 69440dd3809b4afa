/**
 * Cross-cycle hysteresis.
 *
 * <p>
 * {@link com.changesentinel.core.tracking.BreachTracker} turns a stream of
 * {@link com.changesentinel.core.model.BreachDecision}s into confirmed
 * {@link com.changesentinel.core.model.AnomalySignal}s once a metric has
 * breached on enough consecutive evaluations.
 * </p>
 */
package com.changesentinel.core.tracking;
