package com.changesentinel.service;

import com.changesentinel.core.config.MetricRegistry;
import com.changesentinel.core.model.CycleTrigger;
import com.changesentinel.core.model.MetricDefinition;
import com.changesentinel.core.model.MetricSample;
import com.changesentinel.core.orchestration.CycleOrchestrator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CycleScheduler}.
 */
class CycleSchedulerTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final SentinelMetrics metrics = new SentinelMetrics(meterRegistry);
    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);
    private CycleOrchestrator orchestrator;
    private CycleScheduler scheduler;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (scheduler != null) {
            scheduler.stop();
        }
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    @Test
    @DisplayName("Should run a scheduled cycle on each tick")
    void shouldRunScheduledCycle() {
        release.countDown();
        orchestrator = orchestrator();
        scheduler = new CycleScheduler(orchestrator, metrics);

        scheduler.tick();

        assertThat(orchestrator.getHistory().latest()).hasValueSatisfying(
                report -> assertThat(report.getBatch().getTrigger()).isEqualTo(CycleTrigger.SCHEDULED));
    }

    @Test
    @DisplayName("Should count a tick that finds a cycle running as rejected")
    void shouldCountOverlappingTick() throws Exception {
        orchestrator = orchestrator();
        scheduler = new CycleScheduler(orchestrator, metrics);
        CompletableFuture<?> inFlight =
                CompletableFuture.runAsync(() -> orchestrator.runCycle(CycleTrigger.ON_DEMAND));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        scheduler.tick();

        assertThat(meterRegistry.get("sentinel.cycles.rejected").counter().count()).isEqualTo(1.0);
        release.countDown();
        inFlight.get(10, TimeUnit.SECONDS);
        assertThat(orchestrator.getHistory().size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should refuse to start twice")
    void shouldRefuseDoubleStart() {
        release.countDown();
        orchestrator = orchestrator();
        scheduler = new CycleScheduler(orchestrator, metrics);

        scheduler.start(3600, 3600);

        assertThatThrownBy(() -> scheduler.start(3600, 3600))
                .isInstanceOf(IllegalStateException.class);
    }

    private CycleOrchestrator orchestrator() {
        MetricDefinition cpu = new MetricDefinition();
        cpu.setScope("rds");
        cpu.setName("cpu");
        cpu.setAbsoluteThreshold(80.0);
        return CycleOrchestrator.builder()
                .registry(MetricRegistry.of(List.of(cpu)))
                .sampleSource((metric, window) -> {
                    entered.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return List.of(new MetricSample(metric.id(), window.getEnd(), 10));
                })
                .build();
    }
}
