package com.changesentinel.core.report;

import com.changesentinel.core.model.AnomalyReport;

/**
 * Receives every report once it has been stored.
 *
 * <p>
 * Called on the orchestrator thread. A publisher that throws does not affect
 * the cycle or the other publishers; slow work belongs on the publisher's
 * own thread.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ReportPublisher {

    void publish(AnomalyReport report);
}
