package com.phillippitts.coordsim.service.collaborator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Groups the four optional analysis collaborators for constructor injection.
 *
 * <p>Any collaborator may be null; the stage that would call it then degrades to a no-op.
 */
public final class Collaborators {

    public static final String COORDINATE_ANALYZER = "coordinate-analyzer";
    public static final String PERSONA_CALIBRATOR = "persona-calibrator";
    public static final String SIMULATION_RUNNER = "simulation-runner";
    public static final String COMPLIANCE_VALIDATOR = "compliance-validator";

    /** No collaborators at all; every stage is a no-op. */
    public static final Collaborators NONE = new Collaborators(null, null, null, null);

    private final CoordinateAnalyzer coordinateAnalyzer;
    private final PersonaCalibrator personaCalibrator;
    private final SimulationRunner simulationRunner;
    private final ComplianceValidator complianceValidator;

    public Collaborators(CoordinateAnalyzer coordinateAnalyzer,
                         PersonaCalibrator personaCalibrator,
                         SimulationRunner simulationRunner,
                         ComplianceValidator complianceValidator) {
        this.coordinateAnalyzer = coordinateAnalyzer;
        this.personaCalibrator = personaCalibrator;
        this.simulationRunner = simulationRunner;
        this.complianceValidator = complianceValidator;
    }

    public CoordinateAnalyzer getCoordinateAnalyzer() {
        return coordinateAnalyzer;
    }

    public PersonaCalibrator getPersonaCalibrator() {
        return personaCalibrator;
    }

    public SimulationRunner getSimulationRunner() {
        return simulationRunner;
    }

    public ComplianceValidator getComplianceValidator() {
        return complianceValidator;
    }

    /**
     * Availability of each collaborator keyed by its name, in stage order.
     */
    public Map<String, Boolean> availability() {
        Map<String, Boolean> result = new LinkedHashMap<>();
        result.put(COORDINATE_ANALYZER, coordinateAnalyzer != null);
        result.put(PERSONA_CALIBRATOR, personaCalibrator != null);
        result.put(SIMULATION_RUNNER, simulationRunner != null);
        result.put(COMPLIANCE_VALIDATOR, complianceValidator != null);
        return result;
    }
}
