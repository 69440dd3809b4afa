/**
 * Threshold evaluation.
 *
 * <p>
 * {@link com.changesentinel.core.detection.ThresholdEvaluator} turns a
 * {@link com.changesentinel.core.model.MetricWindow} into a
 * {@link com.changesentinel.core.model.BreachDecision} by running the
 * {@link com.changesentinel.core.detection.ThresholdCheck}s that
 * {@link com.changesentinel.core.detection.ThresholdChecks} selects for the
 * metric's comparison mode:
 * </p>
 * <ul>
 * <li>{@link com.changesentinel.core.detection.AbsoluteThresholdCheck} - the
 * current level against a ceiling or floor</li>
 * <li>{@link com.changesentinel.core.detection.PercentageChangeCheck} - the
 * change against the baseline window</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new check, implement {@code ThresholdCheck} and register it in
 * {@code ThresholdChecks.forMode()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.changesentinel.core.detection;
