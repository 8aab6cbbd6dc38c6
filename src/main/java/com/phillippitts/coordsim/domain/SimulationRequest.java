package com.phillippitts.coordsim.domain;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A request to analyze a coordinate through the session pipeline.
 *
 * @param coordinate            coordinate under analysis (required)
 * @param targetPersonas        persona names to calibrate against (may be empty)
 * @param regulatoryConstraints regulatory requirements; a non-empty map adds regulatory validation
 * @param analysisDepth         requested depth: surface, moderate, deep or comprehensive
 * @param optimizationGoals     caller-stated optimization objectives
 */
public record SimulationRequest(
        @NotNull @Valid Coordinate coordinate,
        List<String> targetPersonas,
        Map<String, Object> regulatoryConstraints,
        String analysisDepth,
        List<String> optimizationGoals
) {

    public static final String DEFAULT_ANALYSIS_DEPTH = "deep";

    public SimulationRequest {
        targetPersonas = targetPersonas == null ? List.of() : List.copyOf(targetPersonas);
        regulatoryConstraints = regulatoryConstraints == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(regulatoryConstraints));
        analysisDepth = analysisDepth == null || analysisDepth.isBlank() ? DEFAULT_ANALYSIS_DEPTH : analysisDepth;
        optimizationGoals = optimizationGoals == null ? List.of() : List.copyOf(optimizationGoals);
    }

    /**
     * Creates a request for a coordinate with no personas, constraints or goals.
     */
    public static SimulationRequest of(Coordinate coordinate) {
        return new SimulationRequest(coordinate, List.of(), Map.of(), DEFAULT_ANALYSIS_DEPTH, List.of());
    }

    /**
     * Returns true when the request carries at least one regulatory constraint.
     */
    public boolean hasRegulatoryConstraints() {
        return !regulatoryConstraints.isEmpty();
    }
}
