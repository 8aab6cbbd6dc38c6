package com.phillippitts.coordsim.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiled outcome of one successful workflow run.
 *
 * @param sessionId           session that produced the result
 * @param coordinate          coordinate that was analyzed
 * @param reasoning           coordinate analysis payload, empty when the stage produced nothing
 * @param personaCalibrations persona calibration payload, empty when not planned or unavailable
 * @param regulatoryStatus    regulatory validation payload, empty when not planned or unavailable
 * @param confidence          overall confidence in [0,1]
 * @param recommendations     heuristic follow-up recommendations
 * @param performanceMetrics  elapsed milliseconds keyed by stage wire name
 * @param complexityScore     complexity score computed at session creation
 * @param optimizationApplied whether the optimization pass ran on this result
 * @param completedAt         when the result was compiled
 */
public record SimulationResult(
        String sessionId,
        Coordinate coordinate,
        Map<String, Object> reasoning,
        Map<String, Object> personaCalibrations,
        Map<String, Object> regulatoryStatus,
        double confidence,
        List<String> recommendations,
        Map<String, Long> performanceMetrics,
        double complexityScore,
        boolean optimizationApplied,
        Instant completedAt
) {

    public SimulationResult {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(coordinate, "coordinate must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        reasoning = copy(reasoning);
        personaCalibrations = copy(personaCalibrations);
        regulatoryStatus = copy(regulatoryStatus);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        performanceMetrics = performanceMetrics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(performanceMetrics));
        Objects.requireNonNull(completedAt, "completedAt must not be null");
    }

    /**
     * Returns a copy of this result with a new confidence and optimization flag.
     */
    public SimulationResult withOptimization(double newConfidence, boolean applied) {
        return new SimulationResult(sessionId, coordinate, reasoning, personaCalibrations, regulatoryStatus,
                newConfidence, recommendations, performanceMetrics, complexityScore, applied, completedAt);
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
