package com.changesentinel.service;

import com.changesentinel.core.config.CorrelationSettings;
import com.changesentinel.core.config.MetricRegistry;
import com.changesentinel.core.config.SentinelConfig;
import com.changesentinel.core.config.SentinelConfigLoader;
import com.changesentinel.core.correlation.DeploymentCorrelator;
import com.changesentinel.core.orchestration.CycleOrchestrator;
import com.changesentinel.core.report.ReportHistory;
import com.changesentinel.core.source.RecordingDeploymentFeed;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.logging.LoggingMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Change Sentinel service.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   sentinel.yml -> MetricRegistry
 *   PrometheusSampleSource + RecordingDeploymentFeed (webhook)
 *     -> CycleOrchestrator (scheduled + on-demand)
 *     -> ReportHistory -> LoggingReportPublisher, SentinelMetrics
 *   ApiServer: health, reports, triggers, deployment webhook
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Process settings come from environment variables via
 * {@link ServiceConfig}; detection settings from {@code sentinel.yml} via
 * {@link SentinelConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelService {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelService.class);

    private SentinelService() {
        // entry-point class - not instantiable
    }

    public static void main(String[] args) {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Change Sentinel with config: {}", config);

        SentinelConfig sentinelConfig = SentinelConfigLoader.resolve(config.getConfigPath());
        MetricRegistry registry = sentinelConfig.registry();
        if (registry.isEmpty()) {
            throw new IllegalStateException("No metrics defined. Provide them via "
                    + ServiceConfig.ENV_CONFIG_PATH + " or a classpath "
                    + SentinelConfigLoader.DEFAULT_RESOURCE + " file.");
        }
        LOG.info("Loaded {} metric definition(s)", registry.size());

        // 2. Collaborators
        MeterRegistry meterRegistry = new LoggingMeterRegistry();
        SentinelMetrics metrics = new SentinelMetrics(meterRegistry);
        RecordingDeploymentFeed deploymentFeed = new RecordingDeploymentFeed();
        ReportHistory history = new ReportHistory(sentinelConfig.getCycle().getHistorySize());
        CycleOrchestrator orchestrator = buildOrchestrator(config, sentinelConfig, registry,
                deploymentFeed, history, metrics);

        // 3. HTTP surface and schedule, with shutdown hook
        ApiServer apiServer = new ApiServer(orchestrator, history, deploymentFeed, metrics);
        apiServer.start(config.getHttpPort());
        CycleScheduler scheduler = new CycleScheduler(orchestrator, metrics);
        scheduler.start(config.getCycleInitialDelaySeconds(), config.getCycleIntervalSeconds());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.stop();
            apiServer.stop();
            orchestrator.close();
            meterRegistry.close();
        }, "sentinel-shutdown"));

        apiServer.markReady();
        LOG.info("Change Sentinel ready");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static CycleOrchestrator buildOrchestrator(ServiceConfig config, SentinelConfig sentinelConfig,
            MetricRegistry registry, RecordingDeploymentFeed deploymentFeed, ReportHistory history,
            SentinelMetrics metrics) {
        CorrelationSettings correlation = sentinelConfig.getCorrelation();
        return CycleOrchestrator.builder()
                .registry(registry)
                .sampleSource(new PrometheusSampleSource(config.getPrometheusUrl(), config.getQueryStep()))
                .deploymentFeed(deploymentFeed)
                .correlator(new DeploymentCorrelator(correlation.toPolicy(),
                        correlation.toCausationTable(), correlation.toScopeRelations()))
                .scopeRelations(correlation.toScopeRelations())
                .correlationWindow(correlation.window())
                .cycleSettings(sentinelConfig.getCycle())
                .history(history)
                .publisher(new LoggingReportPublisher())
                .publisher(metrics)
                .build();
    }
}
