package com.changesentinel.service;

import com.changesentinel.core.model.DegradationReason;
import com.changesentinel.core.model.MetricDefinition;
import com.changesentinel.core.model.MetricSample;
import com.changesentinel.core.source.SampleSource;
import com.changesentinel.core.source.SourceUnavailableException;
import com.changesentinel.core.source.WindowSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@link SampleSource} backed by a Prometheus-compatible {@code query_range}
 * API, such as VictoriaMetrics' {@code /select/0/prometheus/api/v1}.
 *
 * <p>
 * Each metric's {@code query} is sent as-is. A query may return several
 * series (one per label set); their values are summed per timestamp, so a
 * per-status-code or per-pod breakdown becomes one total.
 * </p>
 *
 * @since 1.0.0
 */
public class PrometheusSampleSource implements SampleSource {

    private static final Logger LOG = LoggerFactory.getLogger(PrometheusSampleSource.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String step;
    private final HttpClient httpClient;

    public PrometheusSampleSource(String baseUrl, String step) {
        this(baseUrl, step, HttpClient.newHttpClient());
    }

    public PrometheusSampleSource(String baseUrl, String step, HttpClient httpClient) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.step = Objects.requireNonNull(step, "step must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "HttpClient must not be null");
    }

    @Override
    public List<MetricSample> fetchSamples(MetricDefinition metric, WindowSpec window)
            throws SourceUnavailableException {
        String query = metric.getQuery();
        if (query == null || query.isBlank()) {
            throw new SourceUnavailableException(DegradationReason.ERROR,
                    "Metric '" + metric.id() + "' has no query configured", null);
        }

        HttpRequest request = HttpRequest.newBuilder(queryRangeUri(query, window))
                .timeout(window.getTimeout())
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new SourceUnavailableException(DegradationReason.TIMEOUT,
                    "Prometheus query for " + metric.id() + " timed out", e);
        } catch (IOException e) {
            throw new SourceUnavailableException("Prometheus request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(DegradationReason.TIMEOUT,
                    "Prometheus query for " + metric.id() + " interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new SourceUnavailableException("Prometheus query failed: HTTP "
                    + response.statusCode() + " - " + response.body());
        }
        List<MetricSample> samples = parseMatrix(metric.id(), response.body());
        LOG.debug("Fetched {} sample(s) for {} in {}", samples.size(), metric.id(), window);
        return samples;
    }

    URI queryRangeUri(String query, WindowSpec window) {
        return URI.create(baseUrl + "/query_range"
                + "?query=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&start=" + window.getStart().getEpochSecond()
                + "&end=" + window.getEnd().getEpochSecond()
                + "&step=" + URLEncoder.encode(step, StandardCharsets.UTF_8));
    }

    /**
     * Parse a {@code query_range} response body, summing all series per
     * timestamp. Non-numeric values ({@code NaN}, {@code +Inf}) are skipped.
     *
     * @param metricId id to stamp on the samples
     * @param body     response body
     * @return samples ordered by timestamp
     * @throws SourceUnavailableException if the body is not a successful
     *                                    matrix response
     */
    static List<MetricSample> parseMatrix(String metricId, String body) throws SourceUnavailableException {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (IOException e) {
            throw new SourceUnavailableException(DegradationReason.ERROR,
                    "Failed to parse Prometheus response: " + e.getMessage(), e);
        }
        if (root == null || !"success".equals(root.path("status").asText())) {
            throw new SourceUnavailableException("Prometheus returned status '"
                    + (root == null ? "" : root.path("status").asText()) + "'");
        }

        Map<Instant, Double> sums = new TreeMap<>();
        for (JsonNode series : root.path("data").path("result")) {
            for (JsonNode point : series.path("values")) {
                if (!point.isArray() || point.size() < 2) {
                    continue;
                }
                double value;
                try {
                    value = Double.parseDouble(point.get(1).asText());
                } catch (NumberFormatException e) {
                    LOG.debug("Skipping non-numeric value '{}' for {}", point.get(1).asText(), metricId);
                    continue;
                }
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    continue;
                }
                Instant ts = toInstant(point.get(0).asDouble());
                sums.merge(ts, value, Double::sum);
            }
        }

        List<MetricSample> samples = new ArrayList<>(sums.size());
        sums.forEach((ts, value) -> samples.add(new MetricSample(metricId, ts, value)));
        return samples;
    }

    private static Instant toInstant(double epochSeconds) {
        long seconds = (long) Math.floor(epochSeconds);
        long nanos = Math.round((epochSeconds - seconds) * 1_000_000_000L);
        return Instant.ofEpochSecond(seconds, nanos);
    }
}
