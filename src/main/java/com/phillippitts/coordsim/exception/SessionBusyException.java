package com.phillippitts.coordsim.exception;

/**
 * Thrown when a workflow run is requested for a session that is already processing one.
 */
public class SessionBusyException extends CoordSimException {

    private final String sessionId;

    public SessionBusyException(String sessionId) {
        super("Session " + sessionId + " is already processing a simulation");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
