package com.tradecontrol.api.controller;

import com.tradecontrol.api.dto.request.EngineCommandRequest;
import com.tradecontrol.api.dto.response.EngineStatusResponse;
import com.tradecontrol.api.dto.response.SignalAcceptedResponse;
import com.tradecontrol.domain.model.Signal;
import com.tradecontrol.engine.ControlLoop;
import com.tradecontrol.engine.EngineStateHolder;
import com.tradecontrol.engine.EngineStatus;
import com.tradecontrol.engine.HeartbeatSupervisor;
import com.tradecontrol.engine.MonotonicClock;
import com.tradecontrol.ledger.PositionLedger;
import com.tradecontrol.risk.EquityWatermark;
import com.tradecontrol.signal.SignalInbox;
import com.tradecontrol.signal.SignalValidator;
import jakarta.validation.Valid;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Engine lifecycle and signal intake.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/engine/status -- state, degradation, loop liveness</li>
 *   <li>POST /api/engine/start -- pre-flight checks, then RUNNING</li>
 *   <li>POST /api/engine/stop -- RUNNING to STOPPED; open positions are kept</li>
 *   <li>POST /api/engine/rearm -- EMERGENCY_STOPPED to STOPPED</li>
 *   <li>POST /api/engine/signals -- validate and enqueue a signal for the next tick</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/engine")
public class EngineController {

    private static final Logger log = LoggerFactory.getLogger(EngineController.class);

    private final ControlLoop controlLoop;
    private final HeartbeatSupervisor heartbeatSupervisor;
    private final EngineStateHolder engineStateHolder;
    private final SignalValidator signalValidator;
    private final SignalInbox signalInbox;
    private final PositionLedger positionLedger;
    private final EquityWatermark equityWatermark;
    private final MonotonicClock monotonicClock;

    public EngineController(
            ControlLoop controlLoop,
            HeartbeatSupervisor heartbeatSupervisor,
            EngineStateHolder engineStateHolder,
            SignalValidator signalValidator,
            SignalInbox signalInbox,
            PositionLedger positionLedger,
            EquityWatermark equityWatermark,
            MonotonicClock monotonicClock) {
        this.controlLoop = controlLoop;
        this.heartbeatSupervisor = heartbeatSupervisor;
        this.engineStateHolder = engineStateHolder;
        this.signalValidator = signalValidator;
        this.signalInbox = signalInbox;
        this.positionLedger = positionLedger;
        this.equityWatermark = equityWatermark;
        this.monotonicClock = monotonicClock;
    }

    @GetMapping("/status")
    public ResponseEntity<EngineStatusResponse> getStatus() {
        return ResponseEntity.ok(buildStatus());
    }

    @PostMapping("/start")
    public ResponseEntity<EngineStatusResponse> start() {
        log.info("Engine start requested via API");
        controlLoop.start();
        return ResponseEntity.ok(buildStatus());
    }

    @PostMapping("/stop")
    public ResponseEntity<EngineStatusResponse> stop(
            @Valid @RequestBody(required = false) EngineCommandRequest request) {
        String reason = reasonOf(request, "Stopped by operator");
        log.info("Engine stop requested via API: {}", reason);
        controlLoop.stop(reason);
        return ResponseEntity.ok(buildStatus());
    }

    @PostMapping("/rearm")
    public ResponseEntity<EngineStatusResponse> rearm(
            @Valid @RequestBody(required = false) EngineCommandRequest request) {
        String reason = reasonOf(request, "Re-armed by operator");
        log.warn("Engine re-arm requested via API: {}", reason);
        heartbeatSupervisor.rearm(reason);
        return ResponseEntity.ok(buildStatus());
    }

    @PostMapping("/signals")
    public ResponseEntity<SignalAcceptedResponse> submitSignal(@RequestBody Map<String, Object> payload) {
        Signal signal = signalValidator.validate(payload);
        controlLoop.accept(signal);
        log.debug("Signal accepted: {} {}", signal.getAction(), signal.getSymbol());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new SignalAcceptedResponse(signal.getAction(), signal.getSymbol(), signalInbox.size()));
    }

    private EngineStatusResponse buildStatus() {
        EngineStatus status = engineStateHolder.current();
        long lastTickAgeMs = TimeUnit.NANOSECONDS.toMillis(monotonicClock.nanoTime() - controlLoop.getLastTickNanos());
        return EngineStatusResponse.builder()
                .state(status.getState())
                .degradation(status.getDegradation())
                .reason(status.getReason())
                .since(status.getSince())
                .scheduled(controlLoop.isScheduled())
                .tickInFlight(controlLoop.isTickInFlight())
                .skippedTicks(controlLoop.getSkippedTicks())
                .lastTickAgeMs(lastTickAgeMs)
                .restartAttempts(heartbeatSupervisor.getRestartAttempts())
                .acceptingSignals(signalInbox.isAccepting())
                .queuedSignals(signalInbox.size())
                .openPositions(positionLedger.activePositions().size())
                .pendingExecutions(positionLedger.pendingCount())
                .peakEquity(equityWatermark.getPeak())
                .build();
    }

    private static String reasonOf(EngineCommandRequest request, String fallback) {
        if (request == null || request.getReason() == null || request.getReason().isBlank()) {
            return fallback;
        }
        return request.getReason();
    }
}
