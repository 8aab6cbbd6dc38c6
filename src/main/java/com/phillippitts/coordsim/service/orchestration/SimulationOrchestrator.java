package com.phillippitts.coordsim.service.orchestration;

import com.phillippitts.coordsim.domain.SimulationRequest;
import com.phillippitts.coordsim.domain.SimulationResult;
import com.phillippitts.coordsim.service.session.SessionStatusView;
import com.phillippitts.coordsim.service.session.SystemMetricsView;

import java.util.Optional;

/**
 * Runs coordinate simulations through per-session workflows.
 *
 * <p>A session is created from a request, which fixes its complexity assessment and workflow
 * plan. Executing the session runs each planned stage in order against the injected
 * collaborators, compiles a result from the stage artifacts and applies a confidence
 * optimization pass.
 *
 * <p><b>Error Handling:</b> a collaborator failure aborts the remaining stages, moves the
 * session to {@code error}, appends the message to its error list and is rethrown. No retry
 * is attempted; retry policy belongs to the caller.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * String id = orchestrator.createSession(request);
 * SimulationResult result = orchestrator.executeSimulation(id, request);
 * }</pre>
 *
 * @see com.phillippitts.coordsim.service.collaborator.Collaborators
 */
public interface SimulationOrchestrator {

    /**
     * Creates, analyzes and plans a new session.
     *
     * @param request simulation request
     * @return new unique session id
     * @throws com.phillippitts.coordsim.exception.PlanningFailureException if no valid plan exists
     */
    String createSession(SimulationRequest request);

    /**
     * Runs the session's workflow for {@code request}.
     *
     * @param sessionId session to run
     * @param request   request driving the collaborators
     * @return optimized result
     * @throws com.phillippitts.coordsim.exception.SessionNotFoundException if the id is unknown,
     *         or (as {@link com.phillippitts.coordsim.exception.SessionCancelledException}) the
     *         session was reaped during the run
     * @throws com.phillippitts.coordsim.exception.SessionBusyException if the session is already running
     * @throws com.phillippitts.coordsim.exception.CollaboratorFailureException if a stage fails
     */
    SimulationResult executeSimulation(String sessionId, SimulationRequest request);

    Optional<SessionStatusView> getSessionStatus(String sessionId);

    SystemMetricsView getSystemMetrics();

    /**
     * Removes sessions idle for longer than the configured ttl. Never throws.
     *
     * @return number of sessions removed
     */
    int cleanupExpiredSessions();
}
