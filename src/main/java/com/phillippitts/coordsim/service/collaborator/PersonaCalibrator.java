package com.phillippitts.coordsim.service.collaborator;

import com.phillippitts.coordsim.domain.AnalysisArtifact;
import com.phillippitts.coordsim.domain.Coordinate;

import java.util.List;

/**
 * Calibrates persona profiles against a coordinate.
 */
@FunctionalInterface
public interface PersonaCalibrator {

    /**
     * @param coordinate         coordinate to calibrate against
     * @param targetPersonaNames personas requested by the caller, possibly empty
     * @return calibration artifact (never null)
     */
    AnalysisArtifact calibrate(Coordinate coordinate, List<String> targetPersonaNames);
}
