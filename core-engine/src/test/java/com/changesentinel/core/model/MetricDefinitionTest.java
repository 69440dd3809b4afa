package com.changesentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricDefinition}.
 */
class MetricDefinitionTest {

    @Test
    @DisplayName("Should expose scope.name identity and typed defaults")
    void shouldExposeIdentityAndDefaults() {
        MetricDefinition def = definition("rds", "cpu.cluster-1");

        assertThat(def.id()).isEqualTo("rds.cpu.cluster-1");
        assertThat(def.comparisonMode()).isEqualTo(ComparisonMode.ABSOLUTE);
        assertThat(def.badDirection()).isEqualTo(Direction.INCREASE);
        assertThat(def.causationCategory()).isEqualTo(CausationCategory.DEPLOYMENT_GENERIC);
        assertThat(def.window()).isEqualTo(Duration.ofHours(1));
        assertThat(def.baselineLookback()).isEqualTo(Duration.ofDays(7));
        assertThat(def.getConsecutivePoints()).isEqualTo(1);
        assertThatCode(def::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should normalise comparison, direction and category to lowercase")
    void shouldNormaliseCase() {
        MetricDefinition def = definition("redis", "memory");
        def.setComparison("BOTH");
        def.setDirection("Either");
        def.setCategory("Cache-Memory");

        assertThat(def.comparisonMode()).isEqualTo(ComparisonMode.BOTH);
        assertThat(def.badDirection()).isEqualTo(Direction.EITHER);
        assertThat(def.causationCategory()).isEqualTo(CausationCategory.CACHE_MEMORY);
    }

    @Test
    @DisplayName("Should accept percentage-change spellings")
    void shouldAcceptPercentageChangeSpellings() {
        assertThat(ComparisonMode.fromString("percentage_change")).isEqualTo(ComparisonMode.PERCENTAGE_CHANGE);
        assertThat(ComparisonMode.fromString("percentage-change")).isEqualTo(ComparisonMode.PERCENTAGE_CHANGE);
        assertThat(ComparisonMode.fromString("relative")).isEqualTo(ComparisonMode.PERCENTAGE_CHANGE);
    }

    @Test
    @DisplayName("Should report every validation error at once")
    void shouldAggregateValidationErrors() {
        MetricDefinition def = definition("rds", "cpu");
        def.setAbsoluteThreshold(-1.0);
        def.setPercentageThreshold(-5.0);
        def.setConsecutivePoints(0);
        def.setWindowSeconds(0);

        assertThatThrownBy(def::validate)
                .isInstanceOf(InvalidMetricDefinitionException.class)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("absoluteThreshold")
                .hasMessageContaining("percentageThreshold")
                .hasMessageContaining("consecutivePoints")
                .hasMessageContaining("windowSeconds");
    }

    @Test
    @DisplayName("Should require the thresholds the comparison mode uses")
    void shouldRequireThresholdsOfMode() {
        MetricDefinition both = definition("rds", "cpu");
        both.setAbsoluteThreshold(null);
        both.setComparison("both");
        both.setPercentageThreshold(25.0);

        assertThatThrownBy(both::validate)
                .isInstanceOf(InvalidMetricDefinitionException.class)
                .hasMessageContaining("requires 'absoluteThreshold'")
                .hasMessageNotContaining("requires 'percentageThreshold'");

        MetricDefinition relative = definition("orders-api", "http.5xx");
        relative.setComparison("percentage_change");

        assertThatThrownBy(relative::validate)
                .isInstanceOf(InvalidMetricDefinitionException.class)
                .hasMessageContaining("requires 'percentageThreshold'");

        both.setAbsoluteThreshold(0.0);
        assertThatCode(both::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject a scope containing a dot")
    void shouldRejectDottedScope() {
        MetricDefinition def = definition("rds.prod", "cpu");

        assertThatThrownBy(def::validate)
                .isInstanceOf(InvalidMetricDefinitionException.class)
                .hasMessageContaining("malformed scope");
    }

    @Test
    @DisplayName("Should reject unknown comparison and direction")
    void shouldRejectUnknownEnums() {
        MetricDefinition def = definition("rds", "cpu");
        def.setComparison("sideways");
        def.setDirection("up");

        assertThatThrownBy(def::validate)
                .isInstanceOf(InvalidMetricDefinitionException.class)
                .hasMessageContaining("sideways")
                .hasMessageContaining("up");
    }

    @Test
    @DisplayName("Should require scope and name")
    void shouldRequireScopeAndName() {
        MetricDefinition def = new MetricDefinition();

        assertThatThrownBy(def::validate)
                .isInstanceOf(InvalidMetricDefinitionException.class)
                .hasMessageContaining("'scope' is required")
                .hasMessageContaining("'name' is required");
    }

    @Test
    @DisplayName("Should treat definitions with the same identity as equal")
    void shouldUseIdentityForEquality() {
        MetricDefinition a = definition("rds", "cpu");
        MetricDefinition b = definition("rds", "cpu");
        b.setAbsoluteThreshold(99.0);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(definition("rds", "memory"));
    }

    private static MetricDefinition definition(String scope, String name) {
        MetricDefinition def = new MetricDefinition();
        def.setScope(scope);
        def.setName(name);
        def.setAbsoluteThreshold(80.0);
        return def;
    }
}
