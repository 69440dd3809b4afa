/**
 * Configuration loading and validation for Change Sentinel.
 *
 * <p>
 * Metric definitions, correlation tuning and cycle limits are defined in
 * YAML and loaded by
 * {@link com.changesentinel.core.config.SentinelConfigLoader} into a
 * {@link com.changesentinel.core.config.SentinelConfig} instance. The metric
 * section is indexed into a
 * {@link com.changesentinel.core.config.MetricRegistry}. Validation runs
 * eagerly so misconfiguration fails at startup, never mid-cycle.
 * </p>
 *
 * @since 1.0.0
 */
package com.changesentinel.core.config;
