package com.phillippitts.coordsim.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link CollaboratorFailureException} carrying stage diagnostics.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Timeout of a collaborator call
 * throw CollaboratorFailureExceptionBuilder.create("Collaborator call timed out")
 *         .stage("simulation_execution")
 *         .collaborator("simulation-runner")
 *         .durationMs(30_000)
 *         .build();
 *
 * // Failure raised by the collaborator itself
 * throw CollaboratorFailureExceptionBuilder.create("Collaborator call failed")
 *         .stage("regulatory_validation")
 *         .collaborator("compliance-validator")
 *         .cause(exception)
 *         .metadata("sessionId", sessionId)
 *         .build();
 * </pre>
 */
public final class CollaboratorFailureExceptionBuilder {

    private final String message;
    private String stage;
    private String collaborator;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private CollaboratorFailureExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static CollaboratorFailureExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new CollaboratorFailureExceptionBuilder(message);
    }

    public CollaboratorFailureExceptionBuilder stage(String stage) {
        this.stage = stage;
        return this;
    }

    public CollaboratorFailureExceptionBuilder collaborator(String collaborator) {
        this.collaborator = collaborator;
        return this;
    }

    public CollaboratorFailureExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets how long the collaborator call ran before failing.
     *
     * @param durationMs duration in milliseconds
     * @return this builder for chaining
     */
    public CollaboratorFailureExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public CollaboratorFailureExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (durationMs={ms}, {key1}={val1}, ...) (stage: {stage}, collaborator: {name})
     * </pre>
     *
     * @return constructed CollaboratorFailureException
     */
    public CollaboratorFailureException build() {
        String detailedMessage = buildDetailedMessage();
        String stageName = stage != null ? stage : "unknown";
        String collaboratorName = collaborator != null ? collaborator : "unknown";

        if (cause != null) {
            return new CollaboratorFailureException(detailedMessage, stageName, collaboratorName, cause);
        }
        return new CollaboratorFailureException(detailedMessage, stageName, collaboratorName);
    }

    private String buildDetailedMessage() {
        if (durationMs == null && metadata.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }

        return sb.append(')').toString();
    }
}
