package com.changesentinel.core.detection;

import com.changesentinel.core.model.BreachType;
import com.changesentinel.core.model.ComparisonMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ThresholdChecks}.
 */
class ThresholdChecksTest {

    @Test
    @DisplayName("Should select checks per comparison mode")
    void shouldSelectChecksPerMode() {
        assertThat(ThresholdChecks.forMode(ComparisonMode.ABSOLUTE))
                .extracting(ThresholdCheck::type).containsExactly(BreachType.ABSOLUTE);
        assertThat(ThresholdChecks.forMode(ComparisonMode.PERCENTAGE_CHANGE))
                .extracting(ThresholdCheck::type).containsExactly(BreachType.RELATIVE);
        assertThat(ThresholdChecks.forMode(ComparisonMode.BOTH))
                .extracting(ThresholdCheck::type).containsExactly(BreachType.ABSOLUTE, BreachType.RELATIVE);
    }

    @Test
    @DisplayName("Should share stateless check instances")
    void shouldShareInstances() {
        assertThat(ThresholdChecks.forMode(ComparisonMode.BOTH).get(0))
                .isSameAs(ThresholdChecks.forMode(ComparisonMode.ABSOLUTE).get(0));
    }

    @Test
    @DisplayName("Should throw on null mode")
    void shouldThrowOnNullMode() {
        assertThatThrownBy(() -> ThresholdChecks.forMode(null))
                .isInstanceOf(NullPointerException.class);
    }
}
