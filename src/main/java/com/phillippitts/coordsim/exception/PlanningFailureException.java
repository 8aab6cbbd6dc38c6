package com.phillippitts.coordsim.exception;

/**
 * Thrown when the workflow planner produces an empty or structurally invalid plan.
 */
public class PlanningFailureException extends CoordSimException {

    public PlanningFailureException(String message) {
        super(message);
    }
}
