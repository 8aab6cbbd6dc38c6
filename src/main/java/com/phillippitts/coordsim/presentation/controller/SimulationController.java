package com.phillippitts.coordsim.presentation.controller;

import com.phillippitts.coordsim.domain.SimulationRequest;
import com.phillippitts.coordsim.domain.SimulationResult;
import com.phillippitts.coordsim.service.orchestration.SimulationOrchestrator;
import com.phillippitts.coordsim.service.session.SystemMetricsView;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * One-shot simulation and aggregate metrics endpoints.
 */
@RestController
class SimulationController {

    private final SimulationOrchestrator orchestrator;

    SimulationController(SimulationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Creates a session and runs it in one call.
     */
    @PostMapping("/api/simulate/enhanced")
    ResponseEntity<SimulationResult> simulateEnhanced(@Valid @RequestBody SimulationRequest request) {
        String sessionId = orchestrator.createSession(request);
        return ResponseEntity.ok(orchestrator.executeSimulation(sessionId, request));
    }

    @GetMapping("/metrics/system")
    ResponseEntity<SystemMetricsView> systemMetrics() {
        return ResponseEntity.ok(orchestrator.getSystemMetrics());
    }
}
