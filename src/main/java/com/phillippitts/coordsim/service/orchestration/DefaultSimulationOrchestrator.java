package com.phillippitts.coordsim.service.orchestration;

import com.phillippitts.coordsim.domain.SimulationRequest;
import com.phillippitts.coordsim.domain.SimulationResult;
import com.phillippitts.coordsim.domain.WorkflowStage;
import com.phillippitts.coordsim.exception.CollaboratorFailureException;
import com.phillippitts.coordsim.exception.SessionCancelledException;
import com.phillippitts.coordsim.service.orchestration.event.SessionsReapedEvent;
import com.phillippitts.coordsim.service.orchestration.event.SimulationCompletedEvent;
import com.phillippitts.coordsim.service.orchestration.event.SimulationFailedEvent;
import com.phillippitts.coordsim.service.session.OptimizationRecord;
import com.phillippitts.coordsim.service.session.SessionContext;
import com.phillippitts.coordsim.service.session.SessionRegistry;
import com.phillippitts.coordsim.service.session.SessionStatusView;
import com.phillippitts.coordsim.service.session.SystemMetricsView;
import com.phillippitts.coordsim.util.LogSanitizer;
import com.phillippitts.coordsim.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Default implementation of {@link SimulationOrchestrator}.
 *
 * <p>Stages run sequentially on the calling thread; each collaborator call is offloaded to the
 * stage executor with a timeout by {@link StageExecutor}. Cancellation by the reaper is
 * checked between stages, after a collaborator failure and again when the result is committed;
 * the reaper also interrupts the collaborator call in flight.
 *
 * <p>While a workflow runs, the session id is placed in the Log4j2 MDC under {@code sessionId}.
 *
 * @since 1.0
 */
public class DefaultSimulationOrchestrator implements SimulationOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultSimulationOrchestrator.class);

    static final String MDC_SESSION_ID = "sessionId";
    private static final int MAX_ERROR_LENGTH = 500;

    private final SessionRegistry registry;
    private final StageExecutor stageExecutor;
    private final ResultCompiler compiler;
    private final ResultOptimizer optimizer;
    private final ApplicationEventPublisher publisher;
    private final SimulationMetricsPublisher metricsPublisher;
    private final Clock clock;

    public DefaultSimulationOrchestrator(SessionRegistry registry,
                                         StageExecutor stageExecutor,
                                         ResultCompiler compiler,
                                         ResultOptimizer optimizer,
                                         ApplicationEventPublisher publisher,
                                         SimulationMetricsPublisher metricsPublisher,
                                         Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.stageExecutor = Objects.requireNonNull(stageExecutor, "stageExecutor must not be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.metricsPublisher = metricsPublisher != null ? metricsPublisher : SimulationMetricsPublisher.NOOP;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String createSession(SimulationRequest request) {
        SessionContext session = registry.create(request);
        metricsPublisher.recordSessionCreated();
        return session.getSessionId();
    }

    @Override
    public SimulationResult executeSimulation(String sessionId, SimulationRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        SessionContext session = registry.get(sessionId);

        String previousSessionId = ThreadContext.get(MDC_SESSION_ID);
        ThreadContext.put(MDC_SESSION_ID, sessionId);
        try {
            session.beginRun(clock.instant());
            return runWorkflow(session, request);
        } finally {
            if (previousSessionId == null) {
                ThreadContext.remove(MDC_SESSION_ID);
            } else {
                ThreadContext.put(MDC_SESSION_ID, previousSessionId);
            }
        }
    }

    private SimulationResult runWorkflow(SessionContext session, SimulationRequest request) {
        String sessionId = session.getSessionId();
        long start = System.nanoTime();
        WorkflowStage running = WorkflowStage.INITIALIZATION;

        try {
            for (WorkflowStage stage : session.getPlan().stages()) {
                ensureActive(session);
                running = stage;
                StageOutcome outcome = stageExecutor.run(session, stage, request);
                if (outcome.skipped()) {
                    LOG.debug("Stage {} skipped", stage.wireName());
                } else {
                    LOG.debug("Stage {} finished in {} ms (artifact={})", stage.wireName(),
                            outcome.duration().toMillis(), outcome.artifact() != null);
                }
            }
            ensureActive(session);

            running = WorkflowStage.OPTIMIZATION;
            SimulationResult compiled = compiler.compile(session, request, clock.instant());
            long optimizationStart = System.nanoTime();
            SimulationResult optimized = optimizer.optimize(compiled);
            Duration optimizationTime = TimeUtils.elapsedSince(optimizationStart);

            Instant now = clock.instant();
            OptimizationRecord record = new OptimizationRecord(compiled.confidence(), optimized.confidence(), now);
            session.complete(optimized, record, optimizationTime, now);

            registry.recordSuccess();
            registry.recordOptimization();
            metricsPublisher.recordSuccess(System.nanoTime() - start);
            metricsPublisher.recordOptimization(record.enhanced());
            publisher.publishEvent(new SimulationCompletedEvent(
                    sessionId, optimized.confidence(), optimized.recommendations().size(), now));

            LOG.info("Simulation completed in {} ms (confidence={}, stages={})",
                    TimeUtils.elapsedMillis(start),
                    String.format("%.3f", optimized.confidence()),
                    session.getPlan().size());
            return optimized;
        } catch (CollaboratorFailureException e) {
            if (session.isCancelled()) {
                metricsPublisher.recordFailure(running.wireName(), "cancelled", System.nanoTime() - start);
                LOG.warn("Simulation cancelled at stage {}: session was reaped while {} failed",
                        running.wireName(), e.getCollaborator());
                throw new SessionCancelledException(sessionId);
            }
            Instant now = clock.instant();
            String reason = LogSanitizer.truncate(e.getMessage(), MAX_ERROR_LENGTH);
            session.fail(reason, now);
            registry.recordFailure();
            metricsPublisher.recordFailure(running.wireName(), "collaborator_error", System.nanoTime() - start);
            publisher.publishEvent(new SimulationFailedEvent(
                    sessionId, running.wireName(), e.getCollaborator(), reason, now));
            LOG.warn("Simulation aborted at stage {}: {}", running.wireName(), reason);
            throw e;
        } catch (SessionCancelledException e) {
            metricsPublisher.recordFailure(running.wireName(), "cancelled", System.nanoTime() - start);
            LOG.warn("Simulation cancelled at stage {}: session was reaped", running.wireName());
            throw e;
        } catch (RuntimeException e) {
            session.fail(LogSanitizer.describe(e, MAX_ERROR_LENGTH), clock.instant());
            registry.recordFailure();
            metricsPublisher.recordFailure(running.wireName(), "unexpected_error", System.nanoTime() - start);
            LOG.error("Unexpected error at stage {}", running.wireName(), e);
            throw e;
        }
    }

    private static void ensureActive(SessionContext session) {
        if (session.isCancelled()) {
            throw new SessionCancelledException(session.getSessionId());
        }
    }

    @Override
    public Optional<SessionStatusView> getSessionStatus(String sessionId) {
        return registry.status(sessionId);
    }

    @Override
    public SystemMetricsView getSystemMetrics() {
        return registry.metrics();
    }

    @Override
    public int cleanupExpiredSessions() {
        int removed = registry.reapExpired();
        if (removed > 0) {
            try {
                metricsPublisher.recordSessionsReaped(removed);
                publisher.publishEvent(new SessionsReapedEvent(removed, clock.instant()));
            } catch (RuntimeException e) {
                LOG.warn("Failed to publish cleanup of {} session(s): {}", removed, e.getMessage());
            }
        }
        return removed;
    }
}
