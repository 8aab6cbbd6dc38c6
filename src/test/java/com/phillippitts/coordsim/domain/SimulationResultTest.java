package com.phillippitts.coordsim.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulationResultTest {

    private static SimulationResult result(double confidence) {
        return new SimulationResult("s-1", Coordinate.of("foundational", "retail"),
                Map.of("step", 1), null, null, confidence, List.of("r1"),
                Map.of("coordinate_analysis", 12L), 0.3, false, Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void withOptimizationKeepsEverythingElse() {
        SimulationResult original = result(0.6);

        SimulationResult optimized = original.withOptimization(0.7, true);

        assertThat(optimized.confidence()).isEqualTo(0.7);
        assertThat(optimized.optimizationApplied()).isTrue();
        assertThat(optimized.sessionId()).isEqualTo(original.sessionId());
        assertThat(optimized.reasoning()).isEqualTo(original.reasoning());
        assertThat(optimized.performanceMetrics()).isEqualTo(original.performanceMetrics());
        assertThat(optimized.personaCalibrations()).isEmpty();
    }

    @Test
    void rejectsConfidenceAboveOne() {
        assertThatThrownBy(() -> result(1.01)).isInstanceOf(IllegalArgumentException.class);
    }
}
