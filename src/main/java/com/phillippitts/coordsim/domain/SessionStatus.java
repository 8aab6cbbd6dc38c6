package com.phillippitts.coordsim.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a simulation session.
 */
public enum SessionStatus {
    INITIALIZING("initializing"),
    ACTIVE("active"),
    PROCESSING("processing"),
    SUSPENDED("suspended"),
    COMPLETED("completed"),
    ERROR("error");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Returns true for statuses a session never leaves on its own (completed or error).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}
