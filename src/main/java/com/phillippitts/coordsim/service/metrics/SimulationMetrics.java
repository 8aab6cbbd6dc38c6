package com.phillippitts.coordsim.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for simulation workflows.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>End-to-end simulation latency and outcome counts</li>
 *   <li>Per-stage latency</li>
 *   <li>Session lifecycle (created, reaped)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class SimulationMetrics {

    private static final String SIMULATION_PREFIX = "coordsim.simulation";
    private static final String SESSION_PREFIX = "coordsim.session";

    private final MeterRegistry registry;

    public SimulationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the wall-clock time of a whole workflow run.
     *
     * @param outcome "success" or "failure"
     * @param durationNanos duration in nanoseconds
     */
    public void recordSimulationLatency(String outcome, long durationNanos) {
        Timer.builder(SIMULATION_PREFIX + ".latency")
                .description("Time taken to run a simulation workflow")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess() {
        Counter.builder(SIMULATION_PREFIX + ".success")
                .description("Number of successful simulations")
                .register(registry)
                .increment();
    }

    /**
     * @param stage stage that failed
     * @param reason failure category (collaborator_error, cancelled, unexpected_error)
     */
    public void incrementFailure(String stage, String reason) {
        Counter.builder(SIMULATION_PREFIX + ".failure")
                .description("Number of failed simulations")
                .tag("stage", stage)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts an optimization pass.
     *
     * @param enhanced whether the pass raised the confidence
     */
    public void incrementOptimization(boolean enhanced) {
        Counter.builder(SIMULATION_PREFIX + ".optimization")
                .description("Number of optimization passes applied to results")
                .tag("enhanced", String.valueOf(enhanced))
                .register(registry)
                .increment();
    }

    public void recordStageLatency(String stage, long durationNanos) {
        Timer.builder("coordsim.stage.latency")
                .description("Time taken by a single workflow stage")
                .tag("stage", stage)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSessionsCreated() {
        Counter.builder(SESSION_PREFIX + ".created")
                .description("Number of sessions created")
                .register(registry)
                .increment();
    }

    public void incrementSessionsReaped(int count) {
        Counter.builder(SESSION_PREFIX + ".reaped")
                .description("Number of expired sessions removed")
                .register(registry)
                .increment(count);
    }
}
