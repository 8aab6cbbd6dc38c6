package com.phillippitts.coordsim.service.session;

import com.phillippitts.coordsim.domain.AnalysisArtifact;
import com.phillippitts.coordsim.domain.Coordinate;
import com.phillippitts.coordsim.domain.SessionStatus;
import com.phillippitts.coordsim.domain.SimulationResult;
import com.phillippitts.coordsim.domain.WorkflowStage;
import com.phillippitts.coordsim.exception.SessionBusyException;
import com.phillippitts.coordsim.exception.SessionCancelledException;
import com.phillippitts.coordsim.service.analysis.ComplexityAssessment;
import com.phillippitts.coordsim.service.planning.WorkflowPlan;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Thread-safe state of one simulation session.
 *
 * <p>Identity, creation time, coordinate, complexity assessment and workflow plan are fixed at
 * construction. Everything else is mutable and guarded by a per-session {@link ReentrantLock};
 * every public method acquires it, so a snapshot never observes a half-applied stage.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * INITIALIZING → ACTIVE (activate)
 * ACTIVE | COMPLETED | ERROR → PROCESSING (beginRun)
 * PROCESSING → COMPLETED (complete) | ERROR (fail)
 * any → cancelled (markCancelled, reaper only; terminal)
 * </pre>
 *
 * <p>Once cancelled, every mutating call throws {@link SessionCancelledException} so a run in
 * flight cannot write into a session the reaper already removed.
 *
 * @since 1.0
 */
public final class SessionContext {

    static final String OVERALL_CONFIDENCE = "overall";

    private final Lock lock = new ReentrantLock();

    private final String sessionId;
    private final Instant createdAt;
    private final Coordinate primaryCoordinate;
    private final ComplexityAssessment complexity;
    private final WorkflowPlan plan;
    private final Duration complexityAnalysisTime;

    private SessionStatus status = SessionStatus.INITIALIZING;
    private WorkflowStage currentStage = WorkflowStage.INITIALIZATION;
    private boolean currentStageFinished;
    private Instant lastActivity;
    private Instant completedAt;
    private boolean cancelled;
    private Future<?> inFlight;

    private final Map<ArtifactKey, AnalysisArtifact> artifacts = new EnumMap<>(ArtifactKey.class);
    private final Map<WorkflowStage, Duration> stageDurations = new EnumMap<>(WorkflowStage.class);
    private final Map<String, Double> confidenceScores = new LinkedHashMap<>();
    private final List<SimulationResult> results = new ArrayList<>();
    private final List<OptimizationRecord> optimizationHistory = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private Duration optimizationTime = Duration.ZERO;

    SessionContext(String sessionId,
                   Instant createdAt,
                   Coordinate primaryCoordinate,
                   ComplexityAssessment complexity,
                   WorkflowPlan plan,
                   Duration complexityAnalysisTime) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.primaryCoordinate = Objects.requireNonNull(primaryCoordinate, "primaryCoordinate");
        this.complexity = Objects.requireNonNull(complexity, "complexity");
        this.plan = Objects.requireNonNull(plan, "plan");
        this.complexityAnalysisTime = complexityAnalysisTime == null ? Duration.ZERO : complexityAnalysisTime;
        this.lastActivity = createdAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Coordinate getPrimaryCoordinate() {
        return primaryCoordinate;
    }

    public ComplexityAssessment getComplexity() {
        return complexity;
    }

    public WorkflowPlan getPlan() {
        return plan;
    }

    /** Moves a freshly planned session to ACTIVE. */
    void activate() {
        withLock(() -> {
            if (status == SessionStatus.INITIALIZING) {
                status = SessionStatus.ACTIVE;
            }
            return null;
        });
    }

    /**
     * Starts a workflow run.
     *
     * @param now current instant
     * @throws SessionCancelledException if the session has been reaped
     * @throws SessionBusyException if another run is in progress
     */
    public void beginRun(Instant now) {
        withLock(() -> {
            ensureNotCancelled();
            if (status == SessionStatus.PROCESSING) {
                throw new SessionBusyException(sessionId);
            }
            status = SessionStatus.PROCESSING;
            currentStage = WorkflowStage.INITIALIZATION;
            currentStageFinished = false;
            lastActivity = now;
            return null;
        });
    }

    /**
     * Marks a stage as the current one before it runs.
     */
    public void enterStage(WorkflowStage stage, Instant now) {
        withLock(() -> {
            ensureNotCancelled();
            currentStage = stage;
            currentStageFinished = false;
            lastActivity = now;
            return null;
        });
    }

    /**
     * Registers the future of the collaborator call currently running for this session.
     *
     * @return false if the session was already cancelled; the future is cancelled in that case
     */
    public boolean attachInFlight(Future<?> future) {
        boolean attached = withLock(() -> {
            if (cancelled) {
                return false;
            }
            inFlight = future;
            return true;
        });
        if (!attached) {
            future.cancel(true);
        }
        return attached;
    }

    public void detachInFlight(Future<?> future) {
        withLock(() -> {
            if (inFlight == future) {
                inFlight = null;
            }
            return null;
        });
    }

    /**
     * Records the outcome of a finished stage.
     *
     * <p>The duration is always stored. When the artifact is non-null it is stored under the
     * stage's {@link ArtifactKey}; a reported confidence updates the per-stage and overall scores.
     *
     * @param stage    stage that finished
     * @param elapsed  wall-clock time the stage took
     * @param artifact stage output, or null for no-op and marker stages
     * @param now      current instant
     */
    public void recordStage(WorkflowStage stage, Duration elapsed, AnalysisArtifact artifact, Instant now) {
        withLock(() -> {
            ensureNotCancelled();
            stageDurations.put(stage, elapsed);
            if (artifact != null) {
                ArtifactKey.forStage(stage).ifPresent(key -> artifacts.put(key, artifact));
                if (artifact.hasConfidence()) {
                    confidenceScores.put(stage.wireName(), artifact.confidence());
                    confidenceScores.put(OVERALL_CONFIDENCE, meanStageConfidence());
                }
            }
            if (stage == currentStage) {
                currentStageFinished = true;
            }
            lastActivity = now;
            return null;
        });
    }

    /**
     * Records the duration of a stage that failed, leaving it unfinished.
     * Ignored when the session has been cancelled.
     */
    public void recordFailedStage(WorkflowStage stage, Duration elapsed) {
        withLock(() -> {
            if (!cancelled) {
                stageDurations.put(stage, elapsed);
            }
            return null;
        });
    }

    public void addWarning(String warning) {
        withLock(() -> {
            warnings.add(warning);
            return null;
        });
    }

    /**
     * Marks the current run as failed and appends the error message.
     */
    public void fail(String message, Instant now) {
        withLock(() -> {
            if (!cancelled) {
                status = SessionStatus.ERROR;
                errors.add(message);
                lastActivity = now;
            }
            return null;
        });
    }

    /**
     * Stores an optimized result and closes the run.
     *
     * @throws SessionCancelledException if the session was reaped; the result is discarded
     */
    public void complete(SimulationResult result, OptimizationRecord optimization,
                         Duration optimizationElapsed, Instant now) {
        withLock(() -> {
            ensureNotCancelled();
            results.add(result);
            optimizationHistory.add(optimization);
            optimizationTime = optimizationElapsed;
            status = SessionStatus.COMPLETED;
            completedAt = now;
            lastActivity = now;
            return null;
        });
    }

    /**
     * Marks the session cancelled and detaches any in-flight call.
     *
     * @return the in-flight future for the caller to cancel, or null
     */
    Future<?> markCancelled() {
        return withLock(() -> {
            cancelled = true;
            Future<?> pending = inFlight;
            inFlight = null;
            return pending;
        });
    }

    public boolean isCancelled() {
        return withLock(() -> cancelled);
    }

    public SessionStatus getStatus() {
        return withLock(() -> status);
    }

    public WorkflowStage getCurrentStage() {
        return withLock(() -> currentStage);
    }

    public Instant getLastActivity() {
        return withLock(() -> lastActivity);
    }

    /** Visible for tests */
    void setLastActivity(Instant lastActivity) {
        withLock(() -> {
            this.lastActivity = lastActivity;
            return null;
        });
    }

    /**
     * Completion instant of the latest successful run, if any.
     */
    public Optional<Instant> getCompletedAt() {
        return withLock(() -> Optional.ofNullable(completedAt));
    }

    /**
     * Returns true when the session has been idle for longer than the ttl.
     */
    public boolean isExpired(Instant now, Duration ttl) {
        return withLock(() -> Duration.between(lastActivity, now).compareTo(ttl) > 0);
    }

    public Optional<AnalysisArtifact> getArtifact(ArtifactKey key) {
        return withLock(() -> Optional.ofNullable(artifacts.get(key)));
    }

    /**
     * Overall confidence derived from stage-reported confidences, if any stage reported one.
     */
    public Optional<Double> getOverallConfidence() {
        return withLock(() -> Optional.ofNullable(confidenceScores.get(OVERALL_CONFIDENCE)));
    }

    public Duration getStageDuration(WorkflowStage stage) {
        return withLock(() -> stageDurations.getOrDefault(stage, Duration.ZERO));
    }

    public List<String> getErrors() {
        return withLock(() -> List.copyOf(errors));
    }

    public List<String> getWarnings() {
        return withLock(() -> List.copyOf(warnings));
    }

    public List<SimulationResult> getResults() {
        return withLock(() -> List.copyOf(results));
    }

    public List<OptimizationRecord> getOptimizationHistory() {
        return withLock(() -> List.copyOf(optimizationHistory));
    }

    /**
     * Elapsed milliseconds keyed by name: complexity analysis first, then stages in plan
     * order, then the optimization pass when it has run.
     */
    public Map<String, Long> getPerformanceMetrics() {
        return withLock(() -> {
            Map<String, Long> metrics = new LinkedHashMap<>();
            metrics.put("complexity_analysis", complexityAnalysisTime.toMillis());
            for (WorkflowStage stage : plan.stages()) {
                Duration d = stageDurations.get(stage);
                if (d != null) {
                    metrics.put(stage.wireName(), d.toMillis());
                }
            }
            if (!optimizationHistory.isEmpty()) {
                metrics.put("result_optimization", optimizationTime.toMillis());
            }
            return Collections.unmodifiableMap(metrics);
        });
    }

    /**
     * Fraction of the plan that has finished.
     *
     * <p>Equals {@code (index + 1) / size} once the current stage has finished and
     * {@code index / size} while it runs; 0.0 when the current stage is not in the plan.
     */
    public double getProgress() {
        return withLock(() -> {
            int index = plan.indexOf(currentStage);
            if (index < 0 || plan.size() == 0) {
                return 0.0;
            }
            int done = currentStageFinished ? index + 1 : index;
            return (double) done / plan.size();
        });
    }

    /**
     * Takes a consistent snapshot of this session.
     *
     * @param now current instant, used for the session age
     */
    public SessionStatusView snapshot(Instant now) {
        return withLock(() -> new SessionStatusView(
                sessionId,
                status,
                currentStage,
                plan.stages(),
                complexity.score(),
                Duration.between(createdAt, now).toMillis() / 1000.0,
                getProgress(),
                getPerformanceMetrics(),
                Collections.unmodifiableMap(new LinkedHashMap<>(confidenceScores)),
                errors.size(),
                warnings.size(),
                results.size()));
    }

    <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void ensureNotCancelled() {
        if (cancelled) {
            throw new SessionCancelledException(sessionId);
        }
    }

    private double meanStageConfidence() {
        double sum = 0.0;
        int count = 0;
        for (Map.Entry<String, Double> e : confidenceScores.entrySet()) {
            if (!OVERALL_CONFIDENCE.equals(e.getKey())) {
                sum += e.getValue();
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }
}
