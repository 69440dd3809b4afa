package com.changesentinel.core.report;

import com.changesentinel.core.model.AnomalyReport;

import java.util.List;
import java.util.Optional;

/**
 * Read access to recent reports.
 *
 * @since 1.0.0
 */
public interface ReportQuery {

    Optional<AnomalyReport> latest();

    /**
     * @param limit maximum number of reports, must be positive
     * @return up to {@code limit} reports, newest first
     */
    List<AnomalyReport> recent(int limit);

    Optional<AnomalyReport> findByCycleId(String cycleId);
}
