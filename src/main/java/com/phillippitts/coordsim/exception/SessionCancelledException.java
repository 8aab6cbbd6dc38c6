package com.phillippitts.coordsim.exception;

/**
 * Thrown to the caller of a workflow run when its session was reaped while stages were in flight.
 * Any partial result has been discarded; later status queries report the session as not found.
 */
public class SessionCancelledException extends SessionNotFoundException {

    public SessionCancelledException(String sessionId) {
        super(sessionId, "Session " + sessionId + " was reaped during execution");
    }
}
