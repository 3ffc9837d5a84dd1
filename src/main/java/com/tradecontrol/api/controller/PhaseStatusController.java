package com.tradecontrol.api.controller;

import com.tradecontrol.api.dto.request.PhaseOverrideRequest;
import com.tradecontrol.api.dto.response.PhaseStatusResponse;
import com.tradecontrol.config.PhaseProperties;
import com.tradecontrol.domain.model.PhaseState;
import com.tradecontrol.phase.PhaseController;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read side of the aggressiveness phase for scoring collaborators, plus manual override.
 *
 * <ul>
 *   <li>GET /api/phase -- current phase, readiness and metric snapshot</li>
 *   <li>PUT /api/phase/override -- pin the phase and suspend automatic evaluation</li>
 *   <li>POST /api/phase/auto -- resume automatic evaluation</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/phase")
public class PhaseStatusController {

    private final PhaseController phaseController;
    private final PhaseProperties phaseProperties;

    public PhaseStatusController(PhaseController phaseController, PhaseProperties phaseProperties) {
        this.phaseController = phaseController;
        this.phaseProperties = phaseProperties;
    }

    @GetMapping
    public ResponseEntity<PhaseStatusResponse> getPhase() {
        return ResponseEntity.ok(toResponse(phaseController.currentState()));
    }

    @PutMapping("/override")
    public ResponseEntity<PhaseStatusResponse> overridePhase(@Valid @RequestBody PhaseOverrideRequest request) {
        return ResponseEntity.ok(toResponse(phaseController.overridePhase(request.getPhase())));
    }

    @PostMapping("/auto")
    public ResponseEntity<PhaseStatusResponse> resumeAutomatic() {
        return ResponseEntity.ok(toResponse(phaseController.resumeAutomatic()));
    }

    private PhaseStatusResponse toResponse(PhaseState state) {
        return PhaseStatusResponse.builder()
                .phase(state.getPhase())
                .maxPhase(phaseProperties.maxPhase())
                .readiness(state.getReadiness())
                .manualOverride(state.isManualOverride())
                .evaluatedAt(state.getEvaluatedAt())
                .metrics(state.getMetrics())
                .readinessBreakdown(phaseController.lastReport())
                .build();
    }
}
