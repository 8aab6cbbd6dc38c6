package com.phillippitts.coordsim.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SimulationMetricsTest {

    private MeterRegistry registry;
    private SimulationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SimulationMetrics(registry);
    }

    @Test
    void shouldRecordSimulationLatencyByOutcome() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(120);

        metrics.recordSimulationLatency("success", durationNanos);

        Timer timer = registry.find("coordsim.simulation.latency").tag("outcome", "success").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
    }

    @Test
    void shouldTagFailuresByStageAndReason() {
        metrics.incrementFailure("simulation_execution", "collaborator_error");
        metrics.incrementFailure("simulation_execution", "collaborator_error");
        metrics.incrementFailure("coordinate_analysis", "cancelled");

        Counter collaborator = registry.find("coordsim.simulation.failure")
                .tag("stage", "simulation_execution")
                .tag("reason", "collaborator_error")
                .counter();
        Counter cancelled = registry.find("coordsim.simulation.failure")
                .tag("reason", "cancelled")
                .counter();

        assertThat(collaborator).isNotNull();
        assertThat(collaborator.count()).isEqualTo(2.0);
        assertThat(cancelled.count()).isEqualTo(1.0);
    }

    @Test
    void shouldRecordStageLatencyPerStage() {
        metrics.recordStageLatency("coordinate_analysis", 1_000_000);
        metrics.recordStageLatency("synthesis", 2_000_000);

        assertThat(registry.find("coordsim.stage.latency").timers()).hasSize(2);
    }

    @Test
    void shouldCountOptimizationsByEnhancement() {
        metrics.incrementOptimization(true);
        metrics.incrementOptimization(false);
        metrics.incrementOptimization(true);

        assertThat(registry.get("coordsim.simulation.optimization").tag("enhanced", "true").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get("coordsim.simulation.optimization").tag("enhanced", "false").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldCountSessionLifecycle() {
        metrics.incrementSessionsCreated();
        metrics.incrementSuccess();
        metrics.incrementSessionsReaped(4);

        assertThat(registry.get("coordsim.session.created").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("coordsim.simulation.success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("coordsim.session.reaped").counter().count()).isEqualTo(4.0);
    }
}
