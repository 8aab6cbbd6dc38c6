package com.phillippitts.coordsim.presentation.exception;

import com.phillippitts.coordsim.exception.CollaboratorFailureException;
import com.phillippitts.coordsim.exception.PlanningFailureException;
import com.phillippitts.coordsim.exception.SessionBusyException;
import com.phillippitts.coordsim.exception.SessionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping collaborator internals out of client responses.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown or reaped session (HTTP 404).
     */
    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOG.warn("Session lookup failed: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(),
                "Session not found", ex.getMessage());
    }

    /**
     * Concurrent run on the same session (HTTP 409).
     */
    @ExceptionHandler(SessionBusyException.class)
    ResponseEntity<ApiError> handleSessionBusy(SessionBusyException ex) {
        LOG.warn("Rejected concurrent run: session={}", ex.getSessionId());
        return error(HttpStatus.CONFLICT, ex.getClass().getSimpleName(),
                "Session is already processing", "Retry after the current simulation finishes");
    }

    /**
     * Upstream collaborator failed or timed out (HTTP 502).
     */
    @ExceptionHandler(CollaboratorFailureException.class)
    ResponseEntity<ApiError> handleCollaboratorFailure(CollaboratorFailureException ex) {
        LOG.error("Collaborator failure: stage={}, collaborator={}", ex.getStage(), ex.getCollaborator(), ex);
        return error(HttpStatus.BAD_GATEWAY, ex.getClass().getSimpleName(),
                "Simulation collaborator failed",
                "Stage " + ex.getStage() + " failed in " + ex.getCollaborator());
    }

    /**
     * Internal planner invariant violated (HTTP 500).
     */
    @ExceptionHandler(PlanningFailureException.class)
    ResponseEntity<ApiError> handlePlanningFailure(PlanningFailureException ex) {
        LOG.error("Workflow planning failed: {}", ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(),
                "Workflow planning failed", ex.getMessage());
    }

    /**
     * Client error - bean validation failed (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidArgument(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOG.warn("Invalid request: {}", details);
        return error(HttpStatus.BAD_REQUEST, "InvalidRequest", "Request validation failed", details);
    }

    /**
     * Client error - malformed body or invalid coordinate (HTTP 400).
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleMalformed(Exception ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        LOG.warn("Malformed request: {}", root.getMessage());
        return error(HttpStatus.BAD_REQUEST, "InvalidRequest", "Malformed request", root.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500). Framework errors that carry their own status
     * (unknown route, unsupported method) keep it.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            LOG.debug("Framework error {}: {}", status.value(), ex.getMessage());
            return ResponseEntity.status(status).body(new ApiError(
                    ex.getClass().getSimpleName(),
                    errorResponse.getBody().getTitle(),
                    errorResponse.getBody().getDetail(),
                    Instant.now()));
        }
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
            String errorCode,
            String message,
            String details,
            Instant timestamp
    ) {}
}
