package com.phillippitts.coordsim.service.planning;

import com.phillippitts.coordsim.domain.WorkflowStage;

import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable list of stages selected for a session.
 *
 * @param stages stages in execution order
 */
public record WorkflowPlan(List<WorkflowStage> stages) {

    public WorkflowPlan {
        Objects.requireNonNull(stages, "stages must not be null");
        stages = List.copyOf(stages);
    }

    public int size() {
        return stages.size();
    }

    public boolean contains(WorkflowStage stage) {
        return stages.contains(stage);
    }

    /**
     * Position of a stage in the plan.
     *
     * @return zero-based index, or -1 when the stage is not planned
     */
    public int indexOf(WorkflowStage stage) {
        return stages.indexOf(stage);
    }

    public WorkflowStage last() {
        return stages.get(stages.size() - 1);
    }
}
