package com.phillippitts.coordsim.exception;

/**
 * Thrown when an injected collaborator fails, times out or is interrupted during a stage.
 * The remaining stages of the run are abandoned and the session is marked as failed.
 */
public class CollaboratorFailureException extends CoordSimException {

    private static final String UNKNOWN = "unknown";

    private final String stage;
    private final String collaborator;

    public CollaboratorFailureException(String message) {
        super(message);
        this.stage = UNKNOWN;
        this.collaborator = UNKNOWN;
    }

    public CollaboratorFailureException(String message, String stage, String collaborator) {
        super(message + " (stage: " + stage + ", collaborator: " + collaborator + ")");
        this.stage = stage;
        this.collaborator = collaborator;
    }

    public CollaboratorFailureException(String message, String stage, String collaborator, Throwable cause) {
        super(message + " (stage: " + stage + ", collaborator: " + collaborator + ")", cause);
        this.stage = stage;
        this.collaborator = collaborator;
    }

    public String getStage() {
        return stage;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
