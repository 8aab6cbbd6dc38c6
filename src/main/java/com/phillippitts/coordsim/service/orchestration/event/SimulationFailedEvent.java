package com.phillippitts.coordsim.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when a collaborator failure aborted a workflow run.
 *
 * @param sessionId session whose run failed
 * @param stage stage wire name that failed
 * @param collaborator collaborator name, or "unknown"
 * @param reason truncated failure message
 * @param timestamp failure instant
 */
public record SimulationFailedEvent(
        String sessionId,
        String stage,
        String collaborator,
        String reason,
        Instant timestamp
) {}
