/**
 * Per-cycle aggregation of metric outcomes into an
 * {@link com.changesentinel.core.model.AnomalyBatch}.
 */
package com.changesentinel.core.aggregation;
