package com.changesentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@code sentinel.yml} into a validated {@link SentinelConfig}.
 *
 * <p>
 * {@link #resolve(String)} is the single entry point used at start-up: a
 * configured path must point at an existing file, a blank one selects
 * {@value #DEFAULT_RESOURCE} on the classpath. A missing file is an error,
 * never a silent fallback to the bundled definitions. The loader does not
 * read the environment itself; the caller passes whatever path its own
 * configuration resolved.
 * </p>
 *
 * <p>
 * Duplicate YAML keys are rejected and {@link SentinelConfig#validate()} runs
 * on every result, so one bad metric stops start-up with every problem
 * listed.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelConfigLoader.class);

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "sentinel.yml";

    private SentinelConfigLoader() {
        // static helpers only
    }

    /**
     * @param configuredPath file path, or blank/{@code null} for the bundled
     *                       {@value #DEFAULT_RESOURCE}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file or resource does not exist
     * @throws IllegalStateException    if it cannot be read or parsed
     * @throws com.changesentinel.core.model.InvalidMetricDefinitionException
     *                                  if any section is invalid
     */
    public static SentinelConfig resolve(String configuredPath) {
        if (configuredPath == null || configuredPath.isBlank()) {
            return fromClasspath(DEFAULT_RESOURCE);
        }
        return fromFile(configuredPath.trim());
    }

    /**
     * @param path YAML file, absolute or relative to the working directory
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if it cannot be read or parsed
     */
    public static SentinelConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        Path file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Config file not found: " + file.toAbsolutePath());
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader, file.toAbsolutePath().toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file " + file.toAbsolutePath(), e);
        }
    }

    /**
     * @param resource classpath resource name
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if it cannot be read or parsed
     */
    public static SentinelConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream in = SentinelConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return read(reader, "classpath:" + resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource " + resource, e);
        }
    }

    private static SentinelConfig read(Reader reader, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(SentinelConfig.class, options));

        SentinelConfig config;
        try {
            config = yaml.load(reader);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed sentinel configuration in " + origin + ": "
                    + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("{} is empty - no metrics configured", origin);
            config = new SentinelConfig();
        }

        config.validate();
        LOG.info("Loaded {} metric definition(s) from {} (correlation window {}, deadline {})",
                config.getMetrics().size(), origin, config.getCorrelation().window(),
                config.getCycle().deadline());
        return config;
    }
}
