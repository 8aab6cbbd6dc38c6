package com.phillippitts.coordsim.service.orchestration;

import com.phillippitts.coordsim.config.properties.OrchestrationProperties;
import com.phillippitts.coordsim.domain.AnalysisArtifact;
import com.phillippitts.coordsim.domain.SimulationRequest;
import com.phillippitts.coordsim.domain.WorkflowStage;
import com.phillippitts.coordsim.exception.CollaboratorFailureException;
import com.phillippitts.coordsim.exception.CollaboratorFailureExceptionBuilder;
import com.phillippitts.coordsim.exception.SessionCancelledException;
import com.phillippitts.coordsim.service.collaborator.Collaborators;
import com.phillippitts.coordsim.service.session.SessionContext;
import com.phillippitts.coordsim.util.LogSanitizer;
import com.phillippitts.coordsim.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs a single workflow stage against its collaborator.
 *
 * <p>Each collaborator call is wrapped in a {@link FutureTask}, registered on the session, then
 * submitted to the bounded stage executor and awaited for at most
 * {@code coordsim.orchestration.stage-timeout-ms}. A timeout or a reap cancels the task, which
 * interrupts the worker running the collaborator. A full pool rejects the call.
 *
 * <p><b>Stage mapping:</b>
 * <ul>
 *   <li>COORDINATE_ANALYSIS - coordinate analyzer, stored as {@code detailed_analysis}</li>
 *   <li>PERSONA_CALIBRATION - persona calibrator with the requested personas</li>
 *   <li>SIMULATION_EXECUTION - simulation runner with the whole request</li>
 *   <li>REGULATORY_VALIDATION - compliance validator with the regulatory constraints</li>
 *   <li>SYNTHESIS, OPTIMIZATION, COMPLETION, INITIALIZATION - markers, timed only</li>
 * </ul>
 *
 * <p>A missing collaborator turns its stage into a no-op with zero duration and a session
 * warning. A collaborator that throws or times out raises {@link CollaboratorFailureException}.
 */
@Component
public class StageExecutor {

    private static final Logger LOG = LogManager.getLogger(StageExecutor.class);
    private static final int MAX_REASON_LENGTH = 200;

    private final Collaborators collaborators;
    private final Executor executor;
    private final OrchestrationProperties properties;
    private final SimulationMetricsPublisher metricsPublisher;
    private final Clock clock;

    public StageExecutor(Collaborators collaborators,
                         @Qualifier("stageExecutor") Executor executor,
                         OrchestrationProperties properties,
                         SimulationMetricsPublisher metricsPublisher,
                         Clock clock) {
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metricsPublisher = metricsPublisher != null ? metricsPublisher : SimulationMetricsPublisher.NOOP;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs {@code stage} for {@code session} and records its duration and artifact on the session.
     *
     * @param session session being executed
     * @param stage   stage to run
     * @param request request driving the run
     * @return outcome of the stage
     * @throws CollaboratorFailureException if an available collaborator fails or times out
     * @throws SessionCancelledException if the session was reaped while the stage ran
     */
    public StageOutcome run(SessionContext session, WorkflowStage stage, SimulationRequest request) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(request, "request");

        session.enterStage(stage, clock.instant());

        Supplier<AnalysisArtifact> call;
        String collaboratorName;
        switch (stage) {
            case COORDINATE_ANALYSIS -> {
                collaboratorName = Collaborators.COORDINATE_ANALYZER;
                var analyzer = collaborators.getCoordinateAnalyzer();
                call = analyzer == null ? null : () -> analyzer.analyze(request.coordinate());
            }
            case PERSONA_CALIBRATION -> {
                collaboratorName = Collaborators.PERSONA_CALIBRATOR;
                var calibrator = collaborators.getPersonaCalibrator();
                call = calibrator == null ? null
                        : () -> calibrator.calibrate(request.coordinate(), request.targetPersonas());
            }
            case SIMULATION_EXECUTION -> {
                collaboratorName = Collaborators.SIMULATION_RUNNER;
                var runner = collaborators.getSimulationRunner();
                call = runner == null ? null : () -> runner.run(request);
            }
            case REGULATORY_VALIDATION -> {
                collaboratorName = Collaborators.COMPLIANCE_VALIDATOR;
                var validator = collaborators.getComplianceValidator();
                call = validator == null ? null
                        : () -> validator.validate(request.coordinate(), request.regulatoryConstraints());
            }
            default -> {
                return runMarker(session, stage);
            }
        }

        if (call == null) {
            return skip(session, stage, collaboratorName);
        }
        return invoke(session, stage, collaboratorName, call);
    }

    private StageOutcome runMarker(SessionContext session, WorkflowStage stage) {
        long start = System.nanoTime();
        Duration elapsed = TimeUtils.elapsedSince(start);
        session.recordStage(stage, elapsed, null, clock.instant());
        metricsPublisher.recordStage(stage.wireName(), elapsed.toNanos());
        return new StageOutcome(stage, null, elapsed, false);
    }

    private StageOutcome skip(SessionContext session, WorkflowStage stage, String collaboratorName) {
        String warning = collaboratorName + " unavailable; " + stage.wireName() + " skipped";
        LOG.warn("Session {}: {}", session.getSessionId(), warning);
        session.addWarning(warning);
        session.recordStage(stage, Duration.ZERO, null, clock.instant());
        return StageOutcome.skipped(stage);
    }

    private StageOutcome invoke(SessionContext session, WorkflowStage stage, String collaboratorName,
                                Supplier<AnalysisArtifact> call) {
        long timeoutMs = properties.getStageTimeoutMs();
        long start = System.nanoTime();

        FutureTask<AnalysisArtifact> future = new FutureTask<>(call::get);
        if (!session.attachInFlight(future)) {
            throw new SessionCancelledException(session.getSessionId());
        }

        AnalysisArtifact artifact;
        try {
            submit(future, session, stage, collaboratorName);
            artifact = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
            Duration elapsed = TimeUtils.elapsedSince(start);
            session.recordFailedStage(stage, elapsed);
            throw CollaboratorFailureExceptionBuilder.create("Collaborator timed out")
                    .stage(stage.wireName())
                    .collaborator(collaboratorName)
                    .cause(te)
                    .durationMs(timeoutMs)
                    .build();
        } catch (CancellationException ce) {
            throw new SessionCancelledException(session.getSessionId());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            session.recordFailedStage(stage, TimeUtils.elapsedSince(start));
            throw CollaboratorFailureExceptionBuilder.create("Interrupted while waiting for collaborator")
                    .stage(stage.wireName())
                    .collaborator(collaboratorName)
                    .cause(ie)
                    .build();
        } catch (ExecutionException ee) {
            Duration elapsed = TimeUtils.elapsedSince(start);
            session.recordFailedStage(stage, elapsed);
            throw toFailure(stage, collaboratorName, ee.getCause(), elapsed);
        } finally {
            session.detachInFlight(future);
        }

        Duration elapsed = TimeUtils.elapsedSince(start);
        AnalysisArtifact stored = artifact != null ? artifact : AnalysisArtifact.empty();
        session.recordStage(stage, elapsed, stored, clock.instant());
        metricsPublisher.recordStage(stage.wireName(), elapsed.toNanos());
        LOG.debug("Stage {} completed in {} ms via {}", stage.wireName(), elapsed.toMillis(), collaboratorName);
        return new StageOutcome(stage, stored, elapsed, false);
    }

    /**
     * Hands the call to the stage pool. A saturated pool fails the stage; the call never runs on
     * the calling thread.
     */
    private void submit(FutureTask<AnalysisArtifact> future, SessionContext session, WorkflowStage stage,
                        String collaboratorName) {
        try {
            executor.execute(future);
        } catch (RejectedExecutionException e) {
            session.recordFailedStage(stage, Duration.ZERO);
            LOG.warn("Stage pool saturated; {} rejected for {}", stage.wireName(), collaboratorName);
            throw CollaboratorFailureExceptionBuilder.create("Stage pool saturated")
                    .stage(stage.wireName())
                    .collaborator(collaboratorName)
                    .cause(e)
                    .build();
        }
    }

    private static CollaboratorFailureException toFailure(WorkflowStage stage, String collaboratorName,
                                                          Throwable cause, Duration elapsed) {
        if (cause instanceof CollaboratorFailureException cfe) {
            return cfe;
        }
        return CollaboratorFailureExceptionBuilder
                .create("Collaborator failed: " + LogSanitizer.describe(cause, MAX_REASON_LENGTH))
                .stage(stage.wireName())
                .collaborator(collaboratorName)
                .cause(cause)
                .durationMs(elapsed.toMillis())
                .build();
    }
}
