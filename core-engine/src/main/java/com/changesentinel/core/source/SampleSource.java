package com.changesentinel.core.source;

import com.changesentinel.core.model.MetricDefinition;
import com.changesentinel.core.model.MetricSample;

import java.util.List;

/**
 * Supplier of metric samples.
 *
 * <p>
 * Implementations must be safe to call concurrently for different metrics.
 * They should honour {@link WindowSpec#getTimeout()} and respond to thread
 * interruption; the orchestrator interrupts fetches that overrun it.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface SampleSource {

    /**
     * @param metric the metric to fetch
     * @param window the time range
     * @return samples within the range, in any order
     * @throws SourceUnavailableException if the source cannot answer
     */
    List<MetricSample> fetchSamples(MetricDefinition metric, WindowSpec window)
            throws SourceUnavailableException;
}
