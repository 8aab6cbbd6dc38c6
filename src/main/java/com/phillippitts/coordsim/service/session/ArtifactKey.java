package com.phillippitts.coordsim.service.session;

import com.phillippitts.coordsim.domain.WorkflowStage;

import java.util.Optional;

/**
 * Names under which stage artifacts are stored on a session.
 */
public enum ArtifactKey {
    DETAILED_ANALYSIS("detailed_analysis", WorkflowStage.COORDINATE_ANALYSIS),
    PERSONA_CALIBRATIONS("persona_calibrations", WorkflowStage.PERSONA_CALIBRATION),
    SIMULATION_DATA("simulation_data", WorkflowStage.SIMULATION_EXECUTION),
    REGULATORY_VALIDATION("regulatory_validation", WorkflowStage.REGULATORY_VALIDATION);

    private final String wireName;
    private final WorkflowStage stage;

    ArtifactKey(String wireName, WorkflowStage stage) {
        this.wireName = wireName;
        this.stage = stage;
    }

    public String wireName() {
        return wireName;
    }

    public WorkflowStage stage() {
        return stage;
    }

    /**
     * Key for the artifact a stage produces; empty for structural marker stages.
     */
    public static Optional<ArtifactKey> forStage(WorkflowStage stage) {
        for (ArtifactKey key : values()) {
            if (key.stage == stage) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }
}
