package com.phillippitts.coordsim.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of pipeline stages a session's workflow plan may contain.
 *
 * <p>Only {@link #COORDINATE_ANALYSIS}, {@link #PERSONA_CALIBRATION},
 * {@link #SIMULATION_EXECUTION} and {@link #REGULATORY_VALIDATION} delegate to a collaborator;
 * the remaining stages are structural markers that are timed but do no work of their own.
 */
public enum WorkflowStage {
    INITIALIZATION("initialization"),
    COORDINATE_ANALYSIS("coordinate_analysis"),
    PERSONA_CALIBRATION("persona_calibration"),
    SIMULATION_EXECUTION("simulation_execution"),
    REGULATORY_VALIDATION("regulatory_validation"),
    SYNTHESIS("synthesis"),
    OPTIMIZATION("optimization"),
    COMPLETION("completion");

    private final String wireName;

    WorkflowStage(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in status views, timing maps and log lines. */
    @JsonValue
    public String wireName() {
        return wireName;
    }
}
