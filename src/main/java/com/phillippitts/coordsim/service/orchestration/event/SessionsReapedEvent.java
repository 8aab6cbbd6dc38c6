package com.phillippitts.coordsim.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted after a cleanup pass removed at least one expired session.
 */
public record SessionsReapedEvent(int removed, Instant timestamp) {}
