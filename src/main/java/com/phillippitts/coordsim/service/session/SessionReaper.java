package com.phillippitts.coordsim.service.session;

import com.phillippitts.coordsim.service.orchestration.SimulationOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes expired sessions.
 *
 * <p>Runs every {@code coordsim.session.reaper-interval-ms} (default one hour). Disable with
 * {@code coordsim.session.reaper-enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "coordsim.session", name = "reaper-enabled", havingValue = "true",
        matchIfMissing = true)
public class SessionReaper {

    private static final Logger LOG = LogManager.getLogger(SessionReaper.class);

    private final SimulationOrchestrator orchestrator;

    public SessionReaper(SimulationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(fixedRateString = "${coordsim.session.reaper-interval-ms:3600000}",
            initialDelayString = "${coordsim.session.reaper-interval-ms:3600000}")
    void reap() {
        try {
            int removed = orchestrator.cleanupExpiredSessions();
            LOG.debug("Reaper pass finished: removed={}", removed);
        } catch (RuntimeException e) {
            LOG.error("Reaper pass failed: {}", e.getMessage(), e);
        }
    }
}
