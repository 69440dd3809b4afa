package com.changesentinel.core.config;

import com.changesentinel.core.correlation.ScopeRelations;
import com.changesentinel.core.model.CausationCategory;
import com.changesentinel.core.model.ComparisonMode;
import com.changesentinel.core.model.Direction;
import com.changesentinel.core.model.InvalidMetricDefinitionException;
import com.changesentinel.core.model.MetricDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SentinelConfigLoader}.
 */
class SentinelConfigLoaderTest {

    @Test
    @DisplayName("Should load metrics, correlation and cycle settings from classpath")
    void shouldLoadFromClasspath() {
        SentinelConfig config = SentinelConfigLoader.fromClasspath("test-sentinel.yml");

        assertThat(config.getMetrics()).hasSize(2);
        MetricDefinition cpu = config.getMetrics().get(0);
        assertThat(cpu.id()).isEqualTo("rds.cpu.cluster-1");
        assertThat(cpu.comparisonMode()).isEqualTo(ComparisonMode.ABSOLUTE);
        assertThat(cpu.getAbsoluteThreshold()).isEqualTo(80.0);
        assertThat(cpu.getConsecutivePoints()).isEqualTo(2);
        assertThat(cpu.causationCategory()).isEqualTo(CausationCategory.DB_CPU);

        MetricDefinition errors = config.getMetrics().get(1);
        assertThat(errors.comparisonMode()).isEqualTo(ComparisonMode.PERCENTAGE_CHANGE);
        assertThat(errors.badDirection()).isEqualTo(Direction.EITHER);
        assertThat(errors.getMinimumValue()).isEqualTo(10.0);
        assertThat(errors.window()).isEqualTo(Duration.ofMinutes(10));
        assertThat(errors.baselineLookback()).isEqualTo(Duration.ofDays(1));

        assertThat(config.getCorrelation().window()).isEqualTo(Duration.ofMinutes(30));
        assertThat(config.getCorrelation().getProximityFloor()).isEqualTo(0.1);
        assertThat(config.getCycle().getMaxConcurrentFetches()).isEqualTo(4);
        assertThat(config.getCycle().fetchTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getCycle().deadline()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getCycle().getHistorySize()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should turn correlation settings into scoring tables")
    void shouldBuildCorrelationTables() {
        CorrelationSettings correlation = SentinelConfigLoader.fromClasspath("test-sentinel.yml").getCorrelation();

        ScopeRelations relations = correlation.toScopeRelations();
        assertThat(relations.matches("rds", "orders-api")).isTrue();
        assertThat(relations.matches("orders-api", "rds")).isFalse();
        assertThat(correlation.toCausationTable().score(CausationCategory.HTTP_ERROR, CausationCategory.DB_CPU))
                .isEqualTo(0.6);
        assertThat(correlation.toPolicy().getWindow()).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> SentinelConfigLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Config file not found");
    }

    @Test
    @DisplayName("Should report every invalid definition in one exception")
    void shouldAggregateInvalidDefinitions() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromClasspath("invalid-sentinel.yml"))
                .isInstanceOf(InvalidMetricDefinitionException.class)
                .hasMessageContaining("malformed scope")
                .hasMessageContaining("absoluteThreshold")
                .hasMessageContaining("consecutivePoints")
                .hasMessageContaining("sideways");
    }

    @Test
    @DisplayName("Should reject duplicate metric identities")
    void shouldRejectDuplicates() {
        assertThatThrownBy(() -> SentinelConfigLoader.fromClasspath("duplicate-sentinel.yml"))
                .isInstanceOf(InvalidMetricDefinitionException.class)
                .hasMessageContaining("Duplicate metric identity 'redis.memory'");
    }

    @Test
    @DisplayName("Should load an empty file as an empty configuration")
    void shouldLoadEmptyFile(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("empty.yml"), "");

        SentinelConfig config = SentinelConfigLoader.fromFile(file.toString());

        assertThat(config.getMetrics()).isEmpty();
        assertThat(config.registry().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should wrap malformed YAML")
    void shouldWrapMalformedYaml(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("broken.yml"), "metrics: [\n  - scope: rds\n");

        assertThatThrownBy(() -> SentinelConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed sentinel configuration");
    }

    @Test
    @DisplayName("Should reject a deadline shorter than the fetch timeout")
    void shouldRejectShortDeadline(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("cycle.yml"),
                "cycle:\n  fetchTimeoutSeconds: 20\n  deadlineSeconds: 10\n");

        assertThatThrownBy(() -> SentinelConfigLoader.fromFile(file.toString()))
                .isInstanceOf(InvalidMetricDefinitionException.class)
                .hasMessageContaining("deadlineSeconds");
    }

    @Test
    @DisplayName("Should resolve a configured path to that file")
    void shouldResolveConfiguredPath(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("sentinel.yml"),
                "metrics:\n  - scope: rds\n    name: cpu\n    absoluteThreshold: 75\n");

        SentinelConfig config = SentinelConfigLoader.resolve("  " + file + "  ");

        assertThat(config.registry().find("rds.cpu")).isPresent();
    }

    @Test
    @DisplayName("Should fail for a configured path that does not exist instead of using the bundled file")
    void shouldNotFallBackForMissingPath(@TempDir Path dir) {
        assertThatThrownBy(() -> SentinelConfigLoader.resolve(dir.resolve("gone.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Config file not found");
    }

    @Test
    @DisplayName("Should use the bundled resource for a blank path")
    void shouldUseBundledResourceForBlankPath() {
        // core-engine ships no sentinel.yml of its own
        assertThatThrownBy(() -> SentinelConfigLoader.resolve(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(SentinelConfigLoader.DEFAULT_RESOURCE);
    }
}
