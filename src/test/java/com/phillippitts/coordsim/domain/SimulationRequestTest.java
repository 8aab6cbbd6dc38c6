package com.phillippitts.coordsim.domain;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulationRequestTest {

    private static final Coordinate COORDINATE = Coordinate.of("foundational", "retail");

    @Test
    void appliesDefaultsForMissingFields() {
        SimulationRequest request = new SimulationRequest(COORDINATE, null, null, null, null);

        assertThat(request.targetPersonas()).isEmpty();
        assertThat(request.regulatoryConstraints()).isEmpty();
        assertThat(request.analysisDepth()).isEqualTo(SimulationRequest.DEFAULT_ANALYSIS_DEPTH);
        assertThat(request.optimizationGoals()).isEmpty();
        assertThat(request.hasRegulatoryConstraints()).isFalse();
    }

    @Test
    void keepsNullConstraintValues() {
        Map<String, Object> constraints = new HashMap<>();
        constraints.put("gdpr", null);

        SimulationRequest request = new SimulationRequest(COORDINATE, null, constraints, "shallow", null);

        assertThat(request.hasRegulatoryConstraints()).isTrue();
        assertThat(request.regulatoryConstraints()).containsKey("gdpr");
        assertThatThrownBy(() -> request.regulatoryConstraints().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
