package com.changesentinel.core.correlation;

import com.changesentinel.core.model.CausationCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CausationTable}, {@link ScopeRelations} and
 * {@link CorrelationPolicy}.
 */
class CausationTableTest {

    @Test
    @DisplayName("Should score exact, affinity, generic and unrelated categories")
    void shouldScoreCategories() {
        CausationTable table = CausationTable.builder()
                .affinity("http-error", "db-cpu")
                .build();

        assertThat(table.score(CausationCategory.DB_CPU, CausationCategory.DB_CPU)).isEqualTo(1.0);
        assertThat(table.score(CausationCategory.HTTP_ERROR, CausationCategory.DB_CPU)).isEqualTo(0.6);
        assertThat(table.score(CausationCategory.DB_CPU, CausationCategory.HTTP_ERROR)).isEqualTo(0.6);
        assertThat(table.score(CausationCategory.DB_CPU, CausationCategory.DEPLOYMENT_GENERIC)).isEqualTo(0.4);
        assertThat(table.score(CausationCategory.DB_CPU, CausationCategory.CACHE_MEMORY)).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should accept categories declared only in configuration")
    void shouldAcceptCustomCategories() {
        CausationTable table = CausationTable.builder().affinity("queue-depth", "pod-resource").build();

        assertThat(table.score(CausationCategory.of("queue-depth"), CausationCategory.POD_RESOURCE))
                .isEqualTo(CausationTable.AFFINITY);
    }

    @Test
    @DisplayName("Should relate scopes directionally and expand the scopes to query")
    void shouldRelateScopes() {
        ScopeRelations relations = ScopeRelations.builder()
                .relate("rds", "orders-api")
                .relate("rds", "billing-api")
                .build();

        assertThat(relations.matches("rds", "rds")).isTrue();
        assertThat(relations.matches("rds", "billing-api")).isTrue();
        assertThat(relations.matches("orders-api", "rds")).isFalse();
        assertThat(relations.scopesFor("rds")).containsExactly("rds", "orders-api", "billing-api");
        assertThat(relations.scopesFor("redis")).containsExactly("redis");
    }

    @Test
    @DisplayName("Should clamp proximity and confidence")
    void shouldClampScores() {
        CorrelationPolicy policy = new CorrelationPolicy(Duration.ofSeconds(100), 0.1, 0.7, 0.6);

        assertThat(policy.proximity(Duration.ZERO)).isEqualTo(1.0);
        assertThat(policy.proximity(Duration.ofSeconds(100))).isCloseTo(0.1, within(1e-9));
        assertThat(policy.proximity(Duration.ofSeconds(500))).isCloseTo(0.1, within(1e-9));
        assertThat(policy.confidence(1.0, 1.0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject an invalid policy")
    void shouldRejectInvalidPolicy() {
        assertThatThrownBy(() -> new CorrelationPolicy(Duration.ZERO, 0.1, 0.7, 0.3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CorrelationPolicy(Duration.ofMinutes(1), 1.5, 0.7, 0.3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CorrelationPolicy(Duration.ofMinutes(1), 0.1, -0.7, 0.3))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
