package com.phillippitts.coordsim.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when a workflow run produced a result.
 *
 * @param sessionId session that ran
 * @param confidence final confidence after optimization
 * @param recommendationCount number of recommendations attached to the result
 * @param timestamp completion instant
 */
public record SimulationCompletedEvent(
        String sessionId,
        double confidence,
        int recommendationCount,
        Instant timestamp
) {}
