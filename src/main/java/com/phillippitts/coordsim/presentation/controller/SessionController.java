package com.phillippitts.coordsim.presentation.controller;

import com.phillippitts.coordsim.domain.SimulationRequest;
import com.phillippitts.coordsim.domain.SimulationResult;
import com.phillippitts.coordsim.exception.SessionNotFoundException;
import com.phillippitts.coordsim.service.orchestration.SimulationOrchestrator;
import com.phillippitts.coordsim.service.session.SessionStatusView;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Session lifecycle endpoints.
 */
@RestController
@RequestMapping("/api/session")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final SimulationOrchestrator orchestrator;

    SessionController(SimulationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    ResponseEntity<Map<String, Object>> create(@Valid @RequestBody SimulationRequest request) {
        String sessionId = orchestrator.createSession(request);
        LOG.info("Session {} created via API", sessionId);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "session_id", sessionId,
                "status", "created"
        ));
    }

    @PostMapping("/{sessionId}/simulate")
    ResponseEntity<SimulationResult> simulate(@PathVariable String sessionId,
                                              @Valid @RequestBody SimulationRequest request) {
        return ResponseEntity.ok(orchestrator.executeSimulation(sessionId, request));
    }

    @GetMapping("/{sessionId}")
    ResponseEntity<SessionStatusView> status(@PathVariable String sessionId) {
        return orchestrator.getSessionStatus(sessionId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Manual trigger for the expiry sweep the reaper runs on its schedule.
     */
    @PostMapping("/cleanup")
    ResponseEntity<Map<String, Object>> cleanup() {
        int removed = orchestrator.cleanupExpiredSessions();
        return ResponseEntity.ok(Map.of("removed", removed));
    }
}
