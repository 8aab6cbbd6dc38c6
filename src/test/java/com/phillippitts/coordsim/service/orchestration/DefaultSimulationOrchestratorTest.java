package com.phillippitts.coordsim.service.orchestration;

import com.phillippitts.coordsim.config.properties.OrchestrationProperties;
import com.phillippitts.coordsim.config.properties.SessionProperties;
import com.phillippitts.coordsim.domain.AnalysisArtifact;
import com.phillippitts.coordsim.domain.SessionStatus;
import com.phillippitts.coordsim.domain.SimulationRequest;
import com.phillippitts.coordsim.domain.SimulationResult;
import com.phillippitts.coordsim.domain.WorkflowStage;
import com.phillippitts.coordsim.exception.CollaboratorFailureException;
import com.phillippitts.coordsim.exception.CollaboratorFailureExceptionBuilder;
import com.phillippitts.coordsim.exception.SessionBusyException;
import com.phillippitts.coordsim.exception.SessionCancelledException;
import com.phillippitts.coordsim.exception.SessionNotFoundException;
import com.phillippitts.coordsim.service.analysis.ComplexityAnalyzer;
import com.phillippitts.coordsim.service.collaborator.Collaborators;
import com.phillippitts.coordsim.service.orchestration.event.SessionsReapedEvent;
import com.phillippitts.coordsim.service.orchestration.event.SimulationCompletedEvent;
import com.phillippitts.coordsim.service.orchestration.event.SimulationFailedEvent;
import com.phillippitts.coordsim.service.planning.WorkflowPlanner;
import com.phillippitts.coordsim.service.session.SessionContext;
import com.phillippitts.coordsim.service.session.SessionRegistry;
import com.phillippitts.coordsim.service.session.SessionStatusView;
import com.phillippitts.coordsim.testutil.EventCapturingPublisher;
import com.phillippitts.coordsim.testutil.MutableClock;
import com.phillippitts.coordsim.testutil.StubCollaborators;
import com.phillippitts.coordsim.testutil.SyncExecutor;
import com.phillippitts.coordsim.testutil.TestCoordinates;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;

class DefaultSimulationOrchestratorTest {

    private MutableClock clock;
    private EventCapturingPublisher publisher;
    private OrchestrationProperties props;
    private SessionRegistry registry;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T00:00:00Z");
        publisher = new EventCapturingPublisher();
        props = new OrchestrationProperties();
        registry = new SessionRegistry(new ComplexityAnalyzer(), new WorkflowPlanner(), clock,
                new SessionProperties(), props);
        pool = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        ThreadContext.clearAll();
    }

    private DefaultSimulationOrchestrator orchestrator(Collaborators collaborators, Executor executor) {
        StageExecutor stageExecutor = new StageExecutor(collaborators, executor, props,
                SimulationMetricsPublisher.NOOP, clock);
        return new DefaultSimulationOrchestrator(registry, stageExecutor, new ResultCompiler(props),
                new ResultOptimizer(props), publisher, SimulationMetricsPublisher.NOOP, clock);
    }

    @Test
    void fullRunProducesOptimizedResult() {
        DefaultSimulationOrchestrator orchestrator = orchestrator(StubCollaborators.all(0.9), new SyncExecutor());
        SimulationRequest request = TestCoordinates.regulatedRequest();
        String id = orchestrator.createSession(request);

        SimulationResult result = orchestrator.executeSimulation(id, request);

        assertThat(result.sessionId()).isEqualTo(id);
        assertThat(result.confidence()).isCloseTo(0.9, within(1e-9));
        assertThat(result.optimizationApplied()).isTrue();
        assertThat(result.reasoning()).containsEntry("summary", "analysis of adaptive");
        assertThat(result.personaCalibrations()).containsKey("personas");
        assertThat(result.regulatoryStatus()).containsEntry("compliant", true);
        assertThat(result.recommendations()).containsExactly(ResultCompiler.STAGED_ROLLOUT);
        assertThat(result.performanceMetrics()).containsKeys(
                "complexity_analysis", "coordinate_analysis", "persona_calibration",
                "simulation_execution", "regulatory_validation", "optimization", "synthesis");

        SessionStatusView status = orchestrator.getSessionStatus(id).orElseThrow();
        assertThat(status.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(status.progress()).isEqualTo(1.0);
        assertThat(status.resultsCount()).isEqualTo(1);
        assertThat(status.performanceMetrics()).containsKey("result_optimization");

        assertThat(orchestrator.getSystemMetrics().successfulSimulations()).isEqualTo(1);
        assertThat(orchestrator.getSystemMetrics().optimizationImprovements()).isEqualTo(1);
        assertThat(publisher.eventsOfType(SimulationCompletedEvent.class)).hasSize(1);
    }

    @Test
    void lowConfidenceIsRaisedByIncrement() {
        DefaultSimulationOrchestrator orchestrator = orchestrator(StubCollaborators.all(0.5), new SyncExecutor());
        SimulationRequest request = TestCoordinates.basicRequest();

        SimulationResult result = orchestrator.executeSimulation(orchestrator.createSession(request), request);

        assertThat(result.confidence()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void missingCollaboratorsDegradeToNoOps() {
        DefaultSimulationOrchestrator orchestrator = orchestrator(Collaborators.NONE, new SyncExecutor());
        SimulationRequest request = TestCoordinates.basicRequest();
        String id = orchestrator.createSession(request);

        SimulationResult result = orchestrator.executeSimulation(id, request);

        // default 0.75 plus one increment
        assertThat(result.confidence()).isCloseTo(0.85, within(1e-9));
        assertThat(result.reasoning()).isEmpty();
        assertThat(result.performanceMetrics())
                .containsEntry("coordinate_analysis", 0L)
                .containsEntry("simulation_execution", 0L);
        assertThat(orchestrator.getSessionStatus(id).orElseThrow().warningCount()).isEqualTo(2);
    }

    @Test
    void stagesRunInPlanOrder() {
        List<String> calls = new CopyOnWriteArrayList<>();
        Collaborators recording = new Collaborators(
                c -> record(calls, "analyze"),
                (c, p) -> record(calls, "calibrate"),
                r -> record(calls, "run"),
                (c, r) -> record(calls, "validate"));
        DefaultSimulationOrchestrator orchestrator = orchestrator(recording, new SyncExecutor());
        SimulationRequest request = TestCoordinates.regulatedRequest();

        orchestrator.executeSimulation(orchestrator.createSession(request), request);

        assertThat(calls).containsExactly("analyze", "calibrate", "run", "validate");
    }

    @Test
    void collaboratorFailureAbortsRunAndMarksError() {
        AtomicBoolean validatorCalled = new AtomicBoolean();
        Collaborators failing = new Collaborators(
                StubCollaborators.analyzer(0.9),
                StubCollaborators.calibrator(0.9),
                StubCollaborators.failingRunner("engine exploded"),
                (c, r) -> {
                    validatorCalled.set(true);
                    return AnalysisArtifact.empty();
                });
        DefaultSimulationOrchestrator orchestrator = orchestrator(failing, new SyncExecutor());
        SimulationRequest request = TestCoordinates.regulatedRequest();
        String id = orchestrator.createSession(request);

        assertThatThrownBy(() -> orchestrator.executeSimulation(id, request))
                .isInstanceOfSatisfying(CollaboratorFailureException.class, e -> {
                    assertThat(e.getStage()).isEqualTo("simulation_execution");
                    assertThat(e.getCollaborator()).isEqualTo(Collaborators.SIMULATION_RUNNER);
                    assertThat(e.getMessage()).contains("engine exploded");
                });

        assertThat(validatorCalled).isFalse();
        SessionStatusView status = orchestrator.getSessionStatus(id).orElseThrow();
        assertThat(status.status()).isEqualTo(SessionStatus.ERROR);
        assertThat(status.errorCount()).isEqualTo(1);
        assertThat(status.performanceMetrics()).containsKey("simulation_execution");
        assertThat(orchestrator.getSystemMetrics().failedSimulations()).isEqualTo(1);
        assertThat(publisher.eventsOfType(SimulationFailedEvent.class))
                .singleElement()
                .satisfies(e -> assertThat(e.stage()).isEqualTo("simulation_execution"));
    }

    @Test
    void slowCollaboratorTimesOut() {
        props.setStageTimeoutMs(100);
        StubCollaborators.BlockingRunner runner = new StubCollaborators.BlockingRunner();
        DefaultSimulationOrchestrator orchestrator = orchestrator(
                new Collaborators(null, null, runner, null), pool);
        SimulationRequest request = TestCoordinates.basicRequest();
        String id = orchestrator.createSession(request);

        try {
            assertThatThrownBy(() -> orchestrator.executeSimulation(id, request))
                    .isInstanceOf(CollaboratorFailureException.class)
                    .hasMessageContaining("timed out");
            assertThat(orchestrator.getSessionStatus(id).orElseThrow().status()).isEqualTo(SessionStatus.ERROR);
        } finally {
            runner.release();
        }
    }

    @Test
    void unknownSessionFailsWithoutSideEffects() {
        DefaultSimulationOrchestrator orchestrator = orchestrator(StubCollaborators.all(0.9), new SyncExecutor());

        assertThatThrownBy(() -> orchestrator.executeSimulation("nope", TestCoordinates.basicRequest()))
                .isInstanceOf(SessionNotFoundException.class);
        assertThat(orchestrator.getSessionStatus("nope")).isEmpty();
        assertThat(orchestrator.getSystemMetrics().failedSimulations()).isZero();
    }

    @Test
    void concurrentRunOnSameSessionIsRejected() throws Exception {
        StubCollaborators.BlockingRunner runner = new StubCollaborators.BlockingRunner();
        DefaultSimulationOrchestrator orchestrator = orchestrator(
                new Collaborators(null, null, runner, null), pool);
        SimulationRequest request = TestCoordinates.basicRequest();
        String id = orchestrator.createSession(request);

        CompletableFuture<SimulationResult> first =
                CompletableFuture.supplyAsync(() -> orchestrator.executeSimulation(id, request), pool);
        assertThat(runner.awaitStarted()).isTrue();

        assertThatThrownBy(() -> orchestrator.executeSimulation(id, request))
                .isInstanceOf(SessionBusyException.class);

        runner.release();
        assertThat(first.get(5, TimeUnit.SECONDS).optimizationApplied()).isTrue();
    }

    @Test
    void reapingDuringRunCancelsIt() throws Exception {
        StubCollaborators.BlockingRunner runner = new StubCollaborators.BlockingRunner();
        DefaultSimulationOrchestrator orchestrator = orchestrator(
                new Collaborators(null, null, runner, null), pool);
        SimulationRequest request = TestCoordinates.basicRequest();
        String id = orchestrator.createSession(request);

        CompletableFuture<SimulationResult> run =
                CompletableFuture.supplyAsync(() -> orchestrator.executeSimulation(id, request), pool);
        assertThat(runner.awaitStarted()).isTrue();

        clock.advance(Duration.ofHours(25));
        assertThat(orchestrator.cleanupExpiredSessions()).isEqualTo(1);

        await().atMost(5, TimeUnit.SECONDS).until(run::isDone);
        assertThatThrownBy(run::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(SessionCancelledException.class);
        assertThat(orchestrator.getSessionStatus(id)).isEmpty();
        assertThat(orchestrator.getSystemMetrics().successfulSimulations()).isZero();
        assertThat(publisher.eventsOfType(SessionsReapedEvent.class)).hasSize(1);
        runner.release();
    }

    @Test
    void sessionIdIsInMdcOnlyDuringRun() {
        AtomicReference<String> seen = new AtomicReference<>();
        Collaborators capturing = new Collaborators(c -> {
            seen.set(ThreadContext.get(DefaultSimulationOrchestrator.MDC_SESSION_ID));
            return AnalysisArtifact.empty();
        }, null, null, null);
        DefaultSimulationOrchestrator orchestrator = orchestrator(capturing, new SyncExecutor());
        SimulationRequest request = TestCoordinates.basicRequest();
        String id = orchestrator.createSession(request);

        orchestrator.executeSimulation(id, request);

        assertThat(seen.get()).isEqualTo(id);
        assertThat(ThreadContext.get(DefaultSimulationOrchestrator.MDC_SESSION_ID)).isNull();
    }

    @Test
    void completedSessionCanRunAgain() {
        DefaultSimulationOrchestrator orchestrator = orchestrator(StubCollaborators.all(0.9), new SyncExecutor());
        SimulationRequest request = TestCoordinates.basicRequest();
        String id = orchestrator.createSession(request);

        orchestrator.executeSimulation(id, request);
        orchestrator.executeSimulation(id, request);

        assertThat(orchestrator.getSessionStatus(id).orElseThrow().resultsCount()).isEqualTo(2);
        assertThat(orchestrator.getSystemMetrics().successfulSimulations()).isEqualTo(2);
    }

    @Test
    void failureAfterReapingReportsCancellation() {
        StageExecutor reapThenFail = new StageExecutor(Collaborators.NONE, new SyncExecutor(), props,
                SimulationMetricsPublisher.NOOP, clock) {
            @Override
            public StageOutcome run(SessionContext session, WorkflowStage stage, SimulationRequest request) {
                clock.advance(Duration.ofHours(25));
                registry.reapExpired();
                throw CollaboratorFailureExceptionBuilder.create("Collaborator timed out")
                        .stage(stage.wireName())
                        .collaborator(Collaborators.COORDINATE_ANALYZER)
                        .build();
            }
        };
        DefaultSimulationOrchestrator orchestrator = new DefaultSimulationOrchestrator(registry, reapThenFail,
                new ResultCompiler(props), new ResultOptimizer(props), publisher,
                SimulationMetricsPublisher.NOOP, clock);
        SimulationRequest request = TestCoordinates.basicRequest();
        String id = orchestrator.createSession(request);

        assertThatThrownBy(() -> orchestrator.executeSimulation(id, request))
                .isInstanceOf(SessionCancelledException.class);

        assertThat(orchestrator.getSessionStatus(id)).isEmpty();
        assertThat(orchestrator.getSystemMetrics().failedSimulations()).isZero();
        assertThat(publisher.eventsOfType(SimulationFailedEvent.class)).isEmpty();
    }

    private static AnalysisArtifact record(List<String> calls, String name) {
        calls.add(name);
        return AnalysisArtifact.of(Map.of("call", name), 0.9);
    }
}
