package com.phillippitts.coordsim.service.collaborator;

import com.phillippitts.coordsim.domain.AnalysisArtifact;
import com.phillippitts.coordsim.domain.Coordinate;

/**
 * Performs detailed analysis of a coordinate.
 *
 * <p>Implementations may block; the orchestrator calls them on the stage pool with a timeout.
 */
@FunctionalInterface
public interface CoordinateAnalyzer {

    /**
     * Analyzes a coordinate.
     *
     * @param coordinate coordinate to analyze (never null)
     * @return analysis artifact (never null)
     */
    AnalysisArtifact analyze(Coordinate coordinate);
}
