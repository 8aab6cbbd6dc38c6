package com.phillippitts.coordsim.service.orchestration;

import com.phillippitts.coordsim.service.metrics.SimulationMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Centralizes metrics recording for simulation workflows.
 *
 * <p><b>Null Safety:</b> every method is a no-op when no {@link SimulationMetrics} is present,
 * so orchestration code can run without a meter registry in unit tests.
 *
 * @see SimulationMetrics
 */
@Component
public final class SimulationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(SimulationMetricsPublisher.class);

    /**
     * Shared no-op instance for tests and defaults. Never throws and reports
     * {@link #isEnabled()} as false.
     */
    public static final SimulationMetricsPublisher NOOP = new SimulationMetricsPublisher(null);

    private final SimulationMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public SimulationMetricsPublisher(SimulationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("SimulationMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordSuccess(long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordSimulationLatency("success", durationNanos);
        metrics.incrementSuccess();
    }

    /**
     * @param stage stage that was running when the workflow failed
     * @param errorCategory categorization of failure (e.g. "collaborator_error", "cancelled")
     * @param durationNanos time spent before the failure
     */
    public void recordFailure(String stage, String errorCategory, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordSimulationLatency("failure", durationNanos);
        metrics.incrementFailure(stage, errorCategory);
    }

    public void recordStage(String stage, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordStageLatency(stage, durationNanos);
    }

    public void recordOptimization(boolean enhanced) {
        if (metrics == null) {
            return;
        }
        metrics.incrementOptimization(enhanced);
    }

    public void recordSessionCreated() {
        if (metrics == null) {
            return;
        }
        metrics.incrementSessionsCreated();
    }

    public void recordSessionsReaped(int count) {
        if (metrics == null || count <= 0) {
            return;
        }
        metrics.incrementSessionsReaped(count);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
