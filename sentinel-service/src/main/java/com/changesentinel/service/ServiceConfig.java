package com.changesentinel.service;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Typed, immutable configuration of the sentinel service process.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configurable through container env vars or a shell
 * environment. The detection configuration itself lives in
 * {@code sentinel.yml}; this object only says where to find it.
 * </p>
 *
 * <h3>Environment</h3>
 * <ul>
 * <li>{@code HTTP_PORT} (8080)</li>
 * <li>{@code CYCLE_INTERVAL_SECONDS} (300)</li>
 * <li>{@code CYCLE_INITIAL_DELAY_SECONDS} (30)</li>
 * <li>{@code SENTINEL_CONFIG_PATH} (empty: classpath {@code sentinel.yml})</li>
 * <li>{@code PROMETHEUS_URL}</li>
 * <li>{@code QUERY_STEP} (60s)</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    /** Environment variable naming the {@code sentinel.yml} to load. */
    public static final String ENV_CONFIG_PATH = "SENTINEL_CONFIG_PATH";

    public static final String DEFAULT_PROMETHEUS_URL = "http://localhost:8481/select/0/prometheus/api/v1";

    private final int httpPort;
    private final long cycleIntervalSeconds;
    private final long cycleInitialDelaySeconds;
    private final String configPath;
    private final String prometheusUrl;
    private final String queryStep;

    private ServiceConfig(Builder b) {
        this.httpPort = b.httpPort;
        this.cycleIntervalSeconds = b.cycleIntervalSeconds;
        this.cycleInitialDelaySeconds = b.cycleInitialDelaySeconds;
        this.configPath = b.configPath;
        this.prometheusUrl = b.prometheusUrl;
        this.queryStep = b.queryStep;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static ServiceConfig fromEnvironment(UnaryOperator<String> lookup) {
        Environment env = new Environment(lookup);
        try {
            return new Builder()
                    .httpPort(Integer.parseInt(env.get("HTTP_PORT", "8080")))
                    .cycleIntervalSeconds(Long.parseLong(env.get("CYCLE_INTERVAL_SECONDS", "300")))
                    .cycleInitialDelaySeconds(Long.parseLong(env.get("CYCLE_INITIAL_DELAY_SECONDS", "30")))
                    .configPath(env.get(ENV_CONFIG_PATH, ""))
                    .prometheusUrl(env.get("PROMETHEUS_URL", DEFAULT_PROMETHEUS_URL))
                    .queryStep(env.get("QUERY_STEP", "60s"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getHttpPort() {
        return httpPort;
    }

    public long getCycleIntervalSeconds() {
        return cycleIntervalSeconds;
    }

    public long getCycleInitialDelaySeconds() {
        return cycleInitialDelaySeconds;
    }

    /**
     * @return path of the sentinel configuration file, blank for the classpath
     *         default
     */
    public String getConfigPath() {
        return configPath;
    }

    public String getPrometheusUrl() {
        return prometheusUrl;
    }

    public String getQueryStep() {
        return queryStep;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * {@link #build()} validates that the port is in [1, 65535], the interval
     * is positive, the initial delay is not negative and the Prometheus URL and
     * query step are not blank.
     * </p>
     */
    public static class Builder {
        private int httpPort = 8080;
        private long cycleIntervalSeconds = 300;
        private long cycleInitialDelaySeconds = 30;
        private String configPath = "";
        private String prometheusUrl = DEFAULT_PROMETHEUS_URL;
        private String queryStep = "60s";

        public Builder httpPort(int v) {
            this.httpPort = v;
            return this;
        }

        public Builder cycleIntervalSeconds(long v) {
            this.cycleIntervalSeconds = v;
            return this;
        }

        public Builder cycleInitialDelaySeconds(long v) {
            this.cycleInitialDelaySeconds = v;
            return this;
        }

        public Builder configPath(String v) {
            this.configPath = v;
            return this;
        }

        public Builder prometheusUrl(String v) {
            this.prometheusUrl = v;
            return this;
        }

        public Builder queryStep(String v) {
            this.queryStep = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            requireNonBlank(prometheusUrl, "prometheusUrl");
            requireNonBlank(queryStep, "queryStep");
            if (configPath == null) {
                configPath = "";
            }
            if (httpPort < 1 || httpPort > 65_535) {
                throw new IllegalArgumentException("httpPort must be in [1, 65535], got: " + httpPort);
            }
            if (cycleIntervalSeconds < 1) {
                throw new IllegalArgumentException(
                        "cycleIntervalSeconds must be >= 1, got: " + cycleIntervalSeconds);
            }
            if (cycleInitialDelaySeconds < 0) {
                throw new IllegalArgumentException(
                        "cycleInitialDelaySeconds must be >= 0, got: " + cycleInitialDelaySeconds);
            }
            while (prometheusUrl.endsWith("/")) {
                prometheusUrl = prometheusUrl.substring(0, prometheusUrl.length() - 1);
            }
            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static final class Environment {
        private final UnaryOperator<String> lookup;

        Environment(UnaryOperator<String> lookup) {
            this.lookup = Objects.requireNonNull(lookup, "lookup must not be null");
        }

        String get(String name, String defaultValue) {
            String value = lookup.apply(name);
            return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
        }
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "httpPort=" + httpPort +
                ", cycleIntervalSeconds=" + cycleIntervalSeconds +
                ", cycleInitialDelaySeconds=" + cycleInitialDelaySeconds +
                ", configPath='" + configPath + '\'' +
                ", prometheusUrl='" + prometheusUrl + '\'' +
                ", queryStep='" + queryStep + '\'' +
                '}';
    }
}
