package com.phillippitts.coordsim.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of a single collaborator call.
 *
 * <p>The payload is opaque to the orchestrator and is copied on construction. A collaborator
 * that can judge its own certainty reports it through {@code confidence}; otherwise it is null.
 *
 * @param payload    collaborator-specific analysis data
 * @param confidence self-reported confidence in [0,1], or null when not reported
 */
public record AnalysisArtifact(Map<String, Object> payload, Double confidence) {

    public AnalysisArtifact {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public static AnalysisArtifact of(Map<String, Object> payload) {
        return new AnalysisArtifact(payload, null);
    }

    public static AnalysisArtifact of(Map<String, Object> payload, double confidence) {
        return new AnalysisArtifact(payload, confidence);
    }

    public static AnalysisArtifact empty() {
        return new AnalysisArtifact(Map.of(), null);
    }

    public boolean hasConfidence() {
        return confidence != null;
    }
}
