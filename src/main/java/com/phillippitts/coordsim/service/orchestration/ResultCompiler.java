package com.phillippitts.coordsim.service.orchestration;

import com.phillippitts.coordsim.config.properties.OrchestrationProperties;
import com.phillippitts.coordsim.domain.AnalysisArtifact;
import com.phillippitts.coordsim.domain.SimulationRequest;
import com.phillippitts.coordsim.domain.SimulationResult;
import com.phillippitts.coordsim.domain.WorkflowStage;
import com.phillippitts.coordsim.service.session.ArtifactKey;
import com.phillippitts.coordsim.service.session.SessionContext;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link SimulationResult} from the artifacts a session accumulated during its run.
 *
 * <p>Confidence is the session's overall stage confidence when any stage reported one, otherwise
 * {@code coordsim.orchestration.default-confidence}.
 */
@Component
public class ResultCompiler {

    static final double HIGH_COMPLEXITY = 0.8;

    static final String STAGED_ROLLOUT = "Consider implementing staged rollout due to high complexity";
    static final String REVIEW_LOGS = "Review error logs for potential optimization opportunities";
    static final String PERFORMANCE = "Consider performance optimization for faster execution";

    private final OrchestrationProperties properties;

    public ResultCompiler(OrchestrationProperties properties) {
        this.properties = properties;
    }

    public SimulationResult compile(SessionContext session, SimulationRequest request, Instant now) {
        return new SimulationResult(
                session.getSessionId(),
                request.coordinate(),
                payload(session, ArtifactKey.DETAILED_ANALYSIS),
                payload(session, ArtifactKey.PERSONA_CALIBRATIONS),
                payload(session, ArtifactKey.REGULATORY_VALIDATION),
                session.getOverallConfidence().orElse(properties.getDefaultConfidence()),
                recommendations(session),
                session.getPerformanceMetrics(),
                session.getComplexity().score(),
                false,
                now);
    }

    /**
     * Heuristic recommendations, in fixed order: high complexity, recorded errors,
     * slow simulation stage.
     */
    List<String> recommendations(SessionContext session) {
        List<String> recommendations = new ArrayList<>();
        if (session.getComplexity().score() > HIGH_COMPLEXITY) {
            recommendations.add(STAGED_ROLLOUT);
        }
        if (!session.getErrors().isEmpty()) {
            recommendations.add(REVIEW_LOGS);
        }
        long simulationMs = session.getStageDuration(WorkflowStage.SIMULATION_EXECUTION).toMillis();
        if (simulationMs > properties.getSlowSimulationThresholdMs()) {
            recommendations.add(PERFORMANCE);
        }
        return recommendations;
    }

    private static Map<String, Object> payload(SessionContext session, ArtifactKey key) {
        return session.getArtifact(key).map(AnalysisArtifact::payload).orElse(Map.of());
    }
}
