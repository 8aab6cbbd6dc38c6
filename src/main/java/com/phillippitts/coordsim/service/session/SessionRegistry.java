package com.phillippitts.coordsim.service.session;

import com.phillippitts.coordsim.config.properties.OrchestrationProperties;
import com.phillippitts.coordsim.config.properties.SessionProperties;
import com.phillippitts.coordsim.domain.SessionStatus;
import com.phillippitts.coordsim.domain.SimulationRequest;
import com.phillippitts.coordsim.exception.SessionNotFoundException;
import com.phillippitts.coordsim.service.analysis.ComplexityAnalyzer;
import com.phillippitts.coordsim.service.analysis.ComplexityAssessment;
import com.phillippitts.coordsim.service.planning.WorkflowPlan;
import com.phillippitts.coordsim.service.planning.WorkflowPlanner;
import com.phillippitts.coordsim.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory store of simulation sessions.
 *
 * <p>Creation analyzes and plans the request before the session becomes visible, so a
 * registered session always carries its plan. Removal by {@link #reapExpired()} happens under
 * the session lock; a workflow holding a reference to a reaped session sees it as cancelled.
 *
 * <p>Thread-safe. Aggregate counters are monotonic {@link AtomicLong}s.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final Map<String, SessionContext> sessions = new ConcurrentHashMap<>();

    private final ComplexityAnalyzer complexityAnalyzer;
    private final WorkflowPlanner planner;
    private final Clock clock;
    private final SessionProperties sessionProperties;
    private final OrchestrationProperties orchestrationProperties;

    private final AtomicLong totalSessions = new AtomicLong();
    private final AtomicLong successfulSimulations = new AtomicLong();
    private final AtomicLong failedSimulations = new AtomicLong();
    private final AtomicLong optimizationImprovements = new AtomicLong();
    private final AtomicLong sessionsReaped = new AtomicLong();

    public SessionRegistry(ComplexityAnalyzer complexityAnalyzer,
                           WorkflowPlanner planner,
                           Clock clock,
                           SessionProperties sessionProperties,
                           OrchestrationProperties orchestrationProperties) {
        this.complexityAnalyzer = Objects.requireNonNull(complexityAnalyzer, "complexityAnalyzer");
        this.planner = Objects.requireNonNull(planner, "planner");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sessionProperties = Objects.requireNonNull(sessionProperties, "sessionProperties");
        this.orchestrationProperties = Objects.requireNonNull(orchestrationProperties, "orchestrationProperties");
    }

    /**
     * Creates, plans and registers a new session.
     *
     * @param request simulation request; its coordinate becomes the session's primary coordinate
     * @return the registered session
     * @throws com.phillippitts.coordsim.exception.PlanningFailureException if no valid plan exists
     */
    public SessionContext create(SimulationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Instant createdAt = clock.instant();

        long start = System.nanoTime();
        ComplexityAssessment assessment = complexityAnalyzer.analyze(request.coordinate());
        Duration analysisTime = TimeUtils.elapsedSince(start);
        WorkflowPlan plan = planner.plan(assessment.score(), request);

        while (true) {
            String id = UUID.randomUUID().toString();
            SessionContext session = new SessionContext(
                    id, createdAt, request.coordinate(), assessment, plan, analysisTime);
            session.activate();
            if (sessions.putIfAbsent(id, session) == null) {
                totalSessions.incrementAndGet();
                LOG.info("Created session {} (complexity={}, stages={})",
                        id, String.format("%.3f", assessment.score()), plan.size());
                return session;
            }
            LOG.warn("Session id collision on {}; regenerating", id);
        }
    }

    public Optional<SessionContext> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * @throws SessionNotFoundException if no session is registered under the id
     */
    public SessionContext get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Optional<SessionStatusView> status(String sessionId) {
        Instant now = clock.instant();
        return find(sessionId).map(session -> session.snapshot(now));
    }

    public int size() {
        return sessions.size();
    }

    public void recordSuccess() {
        successfulSimulations.incrementAndGet();
    }

    public void recordFailure() {
        failedSimulations.incrementAndGet();
    }

    public void recordOptimization() {
        optimizationImprovements.incrementAndGet();
    }

    /**
     * Aggregates counters and the workflow efficiency over managed sessions.
     *
     * <p>Efficiency is {@code clamp(1 - avgCompletedSeconds / baseline, 0, 1)} over sessions whose
     * status is COMPLETED: 1.0 with no sessions, 0.0 when sessions exist but none is completed.
     */
    public SystemMetricsView metrics() {
        long active = 0;
        long completedCount = 0;
        double completedSeconds = 0.0;
        for (SessionContext session : sessions.values()) {
            SessionStatus status = session.getStatus();
            if (!status.isTerminal()) {
                active++;
            }
            Optional<Instant> completedAt = session.withLock(() ->
                    session.getStatus() == SessionStatus.COMPLETED ? session.getCompletedAt() : Optional.empty());
            if (completedAt.isPresent()) {
                completedCount++;
                completedSeconds += TimeUtils.toSeconds(Duration.between(session.getCreatedAt(), completedAt.get()));
            }
        }

        return new SystemMetricsView(
                totalSessions.get(),
                successfulSimulations.get(),
                failedSimulations.get(),
                active,
                sessions.size(),
                sessionsReaped.get(),
                optimizationImprovements.get(),
                efficiency(sessions.size(), completedCount, completedSeconds),
                clock.instant());
    }

    double efficiency(int managed, long completedCount, double completedSeconds) {
        if (managed == 0) {
            return 1.0;
        }
        if (completedCount == 0) {
            return 0.0;
        }
        double average = completedSeconds / completedCount;
        double raw = 1.0 - average / orchestrationProperties.getEfficiencyBaselineSeconds();
        return Math.max(0.0, Math.min(1.0, raw));
    }

    /**
     * Removes every session idle for longer than the configured ttl and cancels its in-flight
     * stage work. Never throws; a failure on one session is logged and the scan continues.
     *
     * @return number of sessions removed
     */
    public int reapExpired() {
        Instant now = clock.instant();
        Duration ttl = sessionProperties.getTtl();
        List<Future<?>> toCancel = new ArrayList<>();
        int removed = 0;

        for (Map.Entry<String, SessionContext> entry : sessions.entrySet()) {
            String id = entry.getKey();
            SessionContext session = entry.getValue();
            try {
                Boolean reaped = session.withLock(() -> {
                    if (!session.isExpired(now, ttl) || !sessions.remove(id, session)) {
                        return false;
                    }
                    Future<?> pending = session.markCancelled();
                    if (pending != null) {
                        toCancel.add(pending);
                    }
                    return true;
                });
                if (reaped) {
                    removed++;
                    LOG.info("Reaped expired session {}", id);
                }
            } catch (RuntimeException e) {
                LOG.error("Failed to reap session {}: {}", id, e.getMessage(), e);
            }
        }

        for (Future<?> future : toCancel) {
            try {
                future.cancel(true);
            } catch (RuntimeException e) {
                LOG.warn("Failed to cancel in-flight stage work: {}", e.getMessage());
            }
        }

        sessionsReaped.addAndGet(removed);
        return removed;
    }
}
