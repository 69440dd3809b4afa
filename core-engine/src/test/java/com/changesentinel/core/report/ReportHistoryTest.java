package com.changesentinel.core.report;

import com.changesentinel.core.model.AnomalyBatch;
import com.changesentinel.core.model.AnomalyReport;
import com.changesentinel.core.model.CycleTrigger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ReportHistory}.
 */
class ReportHistoryTest {

    @Test
    @DisplayName("Should return nothing before the first report")
    void shouldBeEmptyInitially() {
        ReportHistory history = new ReportHistory();

        assertThat(history.latest()).isEmpty();
        assertThat(history.recent(5)).isEmpty();
        assertThat(history.capacity()).isEqualTo(20);
    }

    @Test
    @DisplayName("Should list newest first and evict beyond capacity")
    void shouldKeepNewestWithinCapacity() {
        ReportHistory history = new ReportHistory(3);
        for (int i = 1; i <= 4; i++) {
            history.add(report("c-" + i));
        }

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.latest()).get().extracting(AnomalyReport::getCycleId).isEqualTo("c-4");
        assertThat(history.recent(2)).extracting(AnomalyReport::getCycleId).containsExactly("c-4", "c-3");
        assertThat(history.recent(10)).extracting(AnomalyReport::getCycleId).containsExactly("c-4", "c-3", "c-2");
        assertThat(history.findByCycleId("c-2")).isPresent();
        assertThat(history.findByCycleId("c-1")).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive limit")
    void shouldRejectInvalidLimit() {
        assertThatThrownBy(() -> new ReportHistory().recent(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static AnomalyReport report(String cycleId) {
        AnomalyBatch batch = AnomalyBatch.builder()
                .cycleId(cycleId)
                .trigger(CycleTrigger.SCHEDULED)
                .startedAt(Instant.EPOCH)
                .build();
        return new AnomalyReport(batch, List.of());
    }
}
