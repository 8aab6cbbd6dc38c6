package com.phillippitts.coordsim.exception;

/**
 * Thrown when a session id is unknown to the registry.
 * Raised before any side effect takes place.
 */
public class SessionNotFoundException extends CoordSimException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session " + sessionId + " not found");
        this.sessionId = sessionId;
    }

    protected SessionNotFoundException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
