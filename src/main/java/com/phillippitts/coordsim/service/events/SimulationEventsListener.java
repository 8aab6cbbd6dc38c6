package com.phillippitts.coordsim.service.events;

import com.phillippitts.coordsim.service.orchestration.event.SessionsReapedEvent;
import com.phillippitts.coordsim.service.orchestration.event.SimulationCompletedEvent;
import com.phillippitts.coordsim.service.orchestration.event.SimulationFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs workflow lifecycle events. Repeated failures of the same collaborator at the same stage
 * are throttled to one warning per minute.
 */
@Component
class SimulationEventsListener {
    private static final Logger LOG = LogManager.getLogger(SimulationEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onSimulationCompleted(SimulationCompletedEvent e) {
        LOG.debug("Simulation completed: session={}, confidence={}, recommendations={}",
                e.sessionId(), e.confidence(), e.recommendationCount());
    }

    @EventListener
    void onSimulationFailed(SimulationFailedEvent e) {
        String key = "failure-" + e.stage() + '-' + e.collaborator();
        if (shouldLog(key, e.timestamp())) {
            LOG.warn("Simulation failed at stage {} (collaborator={}): {}. "
                    + "Check the collaborator before retrying.", e.stage(), e.collaborator(), e.reason());
        }
    }

    @EventListener
    void onSessionsReaped(SessionsReapedEvent e) {
        LOG.info("Session cleanup removed {} expired session(s)", e.removed());
    }

    // Package-private for tests
    boolean shouldLog(String key, Instant now) {
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
