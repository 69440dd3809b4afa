/**
 * Root-cause correlation of confirmed signals with deployments.
 *
 * <p>
 * {@link com.changesentinel.core.correlation.DeploymentCorrelator} scores
 * each candidate deployment by time proximity to the anomaly onset
 * ({@link com.changesentinel.core.correlation.CorrelationPolicy}) and by
 * category fit ({@link com.changesentinel.core.correlation.CausationTable}).
 * Cross-scope attribution is opt-in through
 * {@link com.changesentinel.core.correlation.ScopeRelations}.
 * </p>
 */
package com.changesentinel.core.correlation;
