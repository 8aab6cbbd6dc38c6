package com.phillippitts.coordsim.exception;

/**
 * Base exception for all coordinate simulator errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CoordSimException extends RuntimeException {

    public CoordSimException(String message) {
        super(message);
    }

    public CoordSimException(String message, Throwable cause) {
        super(message, cause);
    }

    public CoordSimException(Throwable cause) {
        super(cause);
    }
}
