package com.phillippitts.coordsim.service.session;

import java.time.Instant;

/**
 * Aggregate view over all sessions the registry has handled.
 *
 * @param totalSessions            sessions created since startup
 * @param successfulSimulations    workflow runs that produced a result
 * @param failedSimulations        workflow runs aborted by a failure
 * @param activeSessions           sessions currently in a non-terminal status
 * @param sessionsManaged          sessions currently held in the registry
 * @param sessionsReaped           sessions evicted for inactivity since startup
 * @param optimizationImprovements optimization passes applied since startup
 * @param workflowEfficiency       1 - average completed-session duration / baseline, in [0,1]
 * @param timestamp                when the view was taken
 */
public record SystemMetricsView(
        long totalSessions,
        long successfulSimulations,
        long failedSimulations,
        long activeSessions,
        int sessionsManaged,
        long sessionsReaped,
        long optimizationImprovements,
        double workflowEfficiency,
        Instant timestamp
) {}
