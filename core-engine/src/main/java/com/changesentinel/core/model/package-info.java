/**
 * Domain model classes for Change Sentinel.
 *
 * <p>
 * This package contains the types shared between the detection core, the
 * correlation engine and the service layer:
 * </p>
 * <ul>
 * <li>{@link com.changesentinel.core.model.MetricDefinition} - typed metric
 * and threshold configuration</li>
 * <li>{@link com.changesentinel.core.model.MetricWindow} - current and
 * baseline samples for one cycle</li>
 * <li>{@link com.changesentinel.core.model.AnomalySignal} - a confirmed
 * anomaly</li>
 * <li>{@link com.changesentinel.core.model.DeploymentEvent} - a change that
 * may explain an anomaly</li>
 * <li>{@link com.changesentinel.core.model.AnomalyReport} - per-cycle result
 * with ranked {@link com.changesentinel.core.model.RcaFinding}s</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.changesentinel.core.model;
