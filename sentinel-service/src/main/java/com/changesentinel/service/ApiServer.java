package com.changesentinel.service;

import com.changesentinel.core.model.AnomalyReport;
import com.changesentinel.core.model.CycleTrigger;
import com.changesentinel.core.model.DeploymentEvent;
import com.changesentinel.core.orchestration.CycleConflictException;
import com.changesentinel.core.orchestration.CycleOrchestrator;
import com.changesentinel.core.report.ReportQuery;
import com.changesentinel.core.source.RecordingDeploymentFeed;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server exposing health, reports and triggers.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} - {@code 200} with {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness} - {@code 200} once the service is ready,
 * {@code 503} before</li>
 * <li>{@code GET /reports/latest} - latest report, {@code 404} if none yet</li>
 * <li>{@code GET /reports?limit=n} - up to {@code n} reports (default 10), newest
 * first</li>
 * <li>{@code GET /reports/{cycleId}} - one report, {@code 404} if unknown or
 * evicted</li>
 * <li>{@code POST /cycles} - run an on-demand cycle; {@code 200} with the
 * report, {@code 409} while another cycle runs</li>
 * <li>{@code POST /deployments} - record a deployment event; {@code 202}, or
 * {@code 400} for a malformed body</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class ApiServer {

    private static final Logger LOG = LoggerFactory.getLogger(ApiServer.class);

    static final int DEFAULT_REPORT_LIMIT = 10;

    private final CycleOrchestrator orchestrator;
    private final ReportQuery reports;
    private final RecordingDeploymentFeed deploymentFeed;
    private final SentinelMetrics metrics;
    private final DeploymentEventDeserializer deserializer = new DeploymentEventDeserializer();

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean ready = new AtomicBoolean(false);

    public ApiServer(CycleOrchestrator orchestrator, ReportQuery reports,
            RecordingDeploymentFeed deploymentFeed, SentinelMetrics metrics) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "CycleOrchestrator must not be null");
        this.reports = Objects.requireNonNull(reports, "ReportQuery must not be null");
        this.deploymentFeed = Objects.requireNonNull(deploymentFeed, "RecordingDeploymentFeed must not be null");
        this.metrics = Objects.requireNonNull(metrics, "SentinelMetrics must not be null");
    }

    /**
     * Start the server.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("HTTP port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind HTTP server on port " + port, e);
        }
        server.createContext("/health", exchange -> guarded(exchange, "GET", this::handleHealth));
        server.createContext("/readiness", exchange -> guarded(exchange, "GET", this::handleReadiness));
        server.createContext("/reports/latest", exchange -> guarded(exchange, "GET", this::handleLatest));
        server.createContext("/reports", exchange -> guarded(exchange, "GET", this::handleReports));
        server.createContext("/cycles", exchange -> guarded(exchange, "POST", this::handleCycle));
        server.createContext("/deployments", exchange -> guarded(exchange, "POST", this::handleDeployment));

        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "api-server-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        running.set(true);
        LOG.info("API server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("API server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    public void markReady() {
        ready.set(true);
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        respond(exchange, 200, Map.of("status", "UP"));
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (ready.get()) {
            respond(exchange, 200, Map.of("status", "READY"));
        } else {
            respond(exchange, 503, Map.of("status", "STARTING"));
        }
    }

    private void handleLatest(HttpExchange exchange) throws IOException {
        if (!"/reports/latest".equals(exchange.getRequestURI().getPath())) {
            respond(exchange, 404, Map.of("error", "not found"));
            return;
        }
        Optional<AnomalyReport> latest = reports.latest();
        if (latest.isPresent()) {
            respond(exchange, 200, latest.get());
        } else {
            respond(exchange, 404, Map.of("error", "no report yet"));
        }
    }

    private void handleReports(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        if (path.equals("/reports") || path.equals("/reports/")) {
            int limit;
            try {
                limit = parseLimit(exchange.getRequestURI().getRawQuery());
            } catch (IllegalArgumentException e) {
                respond(exchange, 400, Map.of("error", e.getMessage()));
                return;
            }
            respond(exchange, 200, reports.recent(limit));
            return;
        }
        String cycleId = path.substring("/reports/".length());
        Optional<AnomalyReport> report = reports.findByCycleId(cycleId);
        if (report.isPresent()) {
            respond(exchange, 200, report.get());
        } else {
            respond(exchange, 404, Map.of("error", "unknown cycle " + cycleId));
        }
    }

    private void handleCycle(HttpExchange exchange) throws IOException {
        try {
            AnomalyReport report = orchestrator.runCycle(CycleTrigger.ON_DEMAND);
            respond(exchange, 200, report);
        } catch (CycleConflictException e) {
            metrics.incrementCyclesRejected();
            respond(exchange, 409, Map.of("error", e.getMessage()));
        }
    }

    private void handleDeployment(HttpExchange exchange) throws IOException {
        byte[] body;
        try (InputStream in = exchange.getRequestBody()) {
            body = in.readAllBytes();
        }
        DeploymentEvent event = deserializer.deserialize(body);
        if (event == null) {
            respond(exchange, 400, Map.of("error", "malformed deployment event"));
            return;
        }
        deploymentFeed.record(event);
        respond(exchange, 202, Map.of("status", "ACCEPTED"));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    static int parseLimit(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return DEFAULT_REPORT_LIMIT;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.startsWith("limit=")) {
                String value = pair.substring("limit=".length());
                int limit;
                try {
                    limit = Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("limit must be an integer, got '" + value + "'");
                }
                if (limit < 1) {
                    throw new IllegalArgumentException("limit must be >= 1, got " + limit);
                }
                return limit;
            }
        }
        return DEFAULT_REPORT_LIMIT;
    }

    private void guarded(HttpExchange exchange, String method, HttpHandler handler) throws IOException {
        try {
            if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", method);
                respond(exchange, 405, Map.of("error", "method not allowed"));
                return;
            }
            try {
                handler.handle(exchange);
            } catch (RuntimeException e) {
                LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                respond(exchange, 500, Map.of("error", "internal error"));
            }
        } finally {
            exchange.close();
        }
    }

    private static void respond(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = ReportJson.toBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
