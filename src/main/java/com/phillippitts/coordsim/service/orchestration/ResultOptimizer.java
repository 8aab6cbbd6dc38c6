package com.phillippitts.coordsim.service.orchestration;

import com.phillippitts.coordsim.config.properties.OrchestrationProperties;
import com.phillippitts.coordsim.domain.SimulationResult;
import org.springframework.stereotype.Component;

/**
 * Cross-validation enhancement pass over a compiled result.
 *
 * <p>A confidence below {@code confidence-threshold} is raised by {@code confidence-increment},
 * capped at 1.0. The returned result is always marked as optimized.
 */
@Component
public class ResultOptimizer {

    private static final double MAX_CONFIDENCE = 1.0;

    private final OrchestrationProperties properties;

    public ResultOptimizer(OrchestrationProperties properties) {
        this.properties = properties;
    }

    public SimulationResult optimize(SimulationResult result) {
        double confidence = result.confidence();
        if (confidence < properties.getConfidenceThreshold()) {
            confidence = Math.min(confidence + properties.getConfidenceIncrement(), MAX_CONFIDENCE);
        }
        return result.withOptimization(confidence, true);
    }
}
