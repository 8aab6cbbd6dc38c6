package com.phillippitts.coordsim.service.collaborator;

import com.phillippitts.coordsim.domain.AnalysisArtifact;
import com.phillippitts.coordsim.domain.Coordinate;

import java.util.Map;

/**
 * Validates a coordinate against regulatory constraints.
 */
@FunctionalInterface
public interface ComplianceValidator {

    /**
     * @param coordinate  coordinate under validation
     * @param constraints regulatory constraints from the request (non-empty when called)
     * @return validation artifact (never null)
     */
    AnalysisArtifact validate(Coordinate coordinate, Map<String, Object> constraints);
}
