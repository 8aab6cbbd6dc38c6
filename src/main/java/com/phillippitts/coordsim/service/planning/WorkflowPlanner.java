package com.phillippitts.coordsim.service.planning;

import com.phillippitts.coordsim.domain.SimulationRequest;
import com.phillippitts.coordsim.domain.WorkflowStage;
import com.phillippitts.coordsim.exception.PlanningFailureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Converts a complexity score and request options into an ordered workflow plan.
 *
 * <p>Starting from {@code [COORDINATE_ANALYSIS, SIMULATION_EXECUTION]}, the rules below are
 * applied in this order. Each rule inserts relative to the list as left by the previous one,
 * so the order matters:
 * <ol>
 *   <li>score &gt; 0.7: insert {@code PERSONA_CALIBRATION} after the first stage and append
 *       {@code OPTIMIZATION}</li>
 *   <li>request carries regulatory constraints: insert {@code REGULATORY_VALIDATION} before the
 *       current last stage</li>
 *   <li>score &gt; 0.8: append {@code SYNTHESIS}</li>
 * </ol>
 */
@Component
public class WorkflowPlanner {

    private static final Logger LOG = LogManager.getLogger(WorkflowPlanner.class);

    static final double PERSONA_THRESHOLD = 0.7;
    static final double SYNTHESIS_THRESHOLD = 0.8;

    /**
     * Builds the workflow plan for a session.
     *
     * @param score   complexity score in [0,1]
     * @param request request whose options influence the plan
     * @return validated, immutable plan
     * @throws PlanningFailureException if the resulting plan is empty or malformed
     */
    public WorkflowPlan plan(double score, SimulationRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        List<WorkflowStage> stages = new ArrayList<>(List.of(
                WorkflowStage.COORDINATE_ANALYSIS,
                WorkflowStage.SIMULATION_EXECUTION));

        if (score > PERSONA_THRESHOLD) {
            stages.add(1, WorkflowStage.PERSONA_CALIBRATION);
            stages.add(WorkflowStage.OPTIMIZATION);
        }

        if (request.hasRegulatoryConstraints()) {
            stages.add(stages.size() - 1, WorkflowStage.REGULATORY_VALIDATION);
        }

        if (score > SYNTHESIS_THRESHOLD) {
            stages.add(WorkflowStage.SYNTHESIS);
        }

        validate(stages);
        LOG.debug("Planned {} stages for score {}: {}", stages.size(), score, stages);
        return new WorkflowPlan(stages);
    }

    /** Visible for tests */
    static void validate(List<WorkflowStage> stages) {
        if (stages.isEmpty()) {
            throw new PlanningFailureException("Workflow plan is empty");
        }
        if (!stages.contains(WorkflowStage.COORDINATE_ANALYSIS)
                || !stages.contains(WorkflowStage.SIMULATION_EXECUTION)) {
            throw new PlanningFailureException("Workflow plan lacks a mandatory stage: " + stages);
        }
        Set<WorkflowStage> seen = EnumSet.noneOf(WorkflowStage.class);
        for (WorkflowStage stage : stages) {
            if (!seen.add(stage)) {
                throw new PlanningFailureException("Workflow plan repeats stage " + stage.wireName());
            }
        }
    }
}
