package com.phillippitts.coordsim.service.collaborator;

import com.phillippitts.coordsim.domain.AnalysisArtifact;
import com.phillippitts.coordsim.domain.SimulationRequest;

/**
 * Runs the core simulation for a full request.
 */
@FunctionalInterface
public interface SimulationRunner {

    AnalysisArtifact run(SimulationRequest request);
}
