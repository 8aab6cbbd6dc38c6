package com.phillippitts.coordsim.service.orchestration;

import com.phillippitts.coordsim.domain.AnalysisArtifact;
import com.phillippitts.coordsim.domain.WorkflowStage;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of running one workflow stage.
 *
 * @param stage    stage that ran
 * @param artifact collaborator output; null for marker stages and skipped stages
 * @param duration wall-clock time, zero when skipped
 * @param skipped  true when the stage's collaborator was not available
 */
public record StageOutcome(WorkflowStage stage, AnalysisArtifact artifact, Duration duration, boolean skipped) {

    public StageOutcome {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
    }

    static StageOutcome skipped(WorkflowStage stage) {
        return new StageOutcome(stage, null, Duration.ZERO, true);
    }
}
