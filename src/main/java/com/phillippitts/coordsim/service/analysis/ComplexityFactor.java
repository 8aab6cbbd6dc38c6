package com.phillippitts.coordsim.service.analysis;

/**
 * The five independent factors that make up a coordinate's complexity score.
 */
public enum ComplexityFactor {
    PILLAR_COMPLEXITY("pillar_complexity"),
    SECTOR_DEPTH("sector_depth"),
    REGULATORY_REQUIREMENTS("regulatory_requirements"),
    PERSONA_REQUIREMENTS("persona_requirements"),
    CROSS_AXIS_DEPENDENCIES("cross_axis_dependencies");

    private final String wireName;

    ComplexityFactor(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
