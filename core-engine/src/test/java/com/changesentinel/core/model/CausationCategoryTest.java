package com.changesentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CausationCategory}.
 */
class CausationCategoryTest {

    @Test
    @DisplayName("Should resolve well-known tags to the shared constants")
    void shouldResolveWellKnownTags() {
        assertThat(CausationCategory.of("db-cpu")).isEqualTo(CausationCategory.DB_CPU);
        assertThat(CausationCategory.of("deployment-generic").isGeneric()).isTrue();
    }

    @Test
    @DisplayName("Should accept new lowercase tags")
    void shouldAcceptCustomTags() {
        CausationCategory queue = CausationCategory.of("queue-depth");

        assertThat(queue.name()).isEqualTo("queue-depth");
        assertThat(queue.isGeneric()).isFalse();
        assertThat(queue).isEqualTo(CausationCategory.of("queue-depth"));
    }

    @Test
    @DisplayName("Should reject malformed tags")
    void shouldRejectMalformedTags() {
        assertThatThrownBy(() -> CausationCategory.of("DB CPU"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CausationCategory.of(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
