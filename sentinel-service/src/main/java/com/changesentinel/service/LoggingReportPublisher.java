package com.changesentinel.service;

import com.changesentinel.core.model.AnomalyReport;
import com.changesentinel.core.model.RcaFinding;
import com.changesentinel.core.report.ReportPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a summary of every report to the log, one line per finding, and
 * the full JSON at DEBUG.
 */
public class LoggingReportPublisher implements ReportPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingReportPublisher.class);

    @Override
    public void publish(AnomalyReport report) {
        if (!report.hasAnomalies()) {
            LOG.info("Cycle [{}]: no anomalies ({} metric(s) evaluated, {} degraded)",
                    report.getCycleId(), report.getBatch().getEvaluatedMetrics().size(),
                    report.getBatch().getDegradedSources().size());
        } else {
            for (RcaFinding finding : report.getFindings()) {
                LOG.warn("Cycle [{}]: {} {} ({} -> {}) likely caused by {} {} deployed by {} at {}, confidence {}",
                        report.getCycleId(),
                        finding.getSignal().getSeverity(),
                        finding.getSignal().getMetricId(),
                        finding.getSignal().getBaselineValue(),
                        finding.getSignal().getObservedValue(),
                        finding.getPrimary().getDeployment().getScope(),
                        finding.getPrimary().getDeployment().getVersion(),
                        finding.getPrimary().getDeployment().getActor(),
                        finding.getPrimary().getDeployment().getTimestamp(),
                        String.format("%.2f", finding.getConfidence()));
            }
            report.getUnattributedSignals().forEach(signal -> LOG.warn(
                    "Cycle [{}]: {} {} observed {} (onset {}), no deployment correlated",
                    report.getCycleId(), signal.getSeverity(), signal.getMetricId(),
                    signal.getObservedValue(), signal.getOnset()));
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Report: {}", ReportJson.toJson(report));
        }
    }
}
