package com.tradecontrol.recovery;

import com.tradecontrol.config.EngineProperties;
import com.tradecontrol.domain.model.PhaseState;
import com.tradecontrol.engine.ControlLoop;
import com.tradecontrol.engine.HeartbeatSupervisor;
import com.tradecontrol.ledger.PositionLedger;
import com.tradecontrol.phase.PhaseController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Runs the startup recovery sequence after the application is ready.
 *
 * <ol>
 *   <li>Reload active positions and unresolved trades into the ledger</li>
 *   <li>Restore the persisted phase and schedule phase evaluation</li>
 *   <li>Start the heartbeat supervisor</li>
 *   <li>Start the control loop if {@code tradecontrol.engine.auto-start} is set</li>
 * </ol>
 *
 * <p>The engine always boots STOPPED. A failed auto-start is logged and leaves it STOPPED for
 * an operator to start through the API.
 */
@Service
public class StartupRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final PositionLedger positionLedger;
    private final PhaseController phaseController;
    private final HeartbeatSupervisor heartbeatSupervisor;
    private final ControlLoop controlLoop;
    private final EngineProperties engineProperties;

    public StartupRecoveryService(
            PositionLedger positionLedger,
            PhaseController phaseController,
            HeartbeatSupervisor heartbeatSupervisor,
            ControlLoop controlLoop,
            EngineProperties engineProperties) {
        this.positionLedger = positionLedger;
        this.phaseController = phaseController;
        this.heartbeatSupervisor = heartbeatSupervisor;
        this.controlLoop = controlLoop;
        this.engineProperties = engineProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void onApplicationReady() {
        log.info("Starting recovery sequence...");
        long startedAt = System.currentTimeMillis();

        positionLedger.recover();

        PhaseState phase = phaseController.restore();
        phaseController.start();

        heartbeatSupervisor.startPulse();

        if (engineProperties.isAutoStart()) {
            try {
                controlLoop.start();
            } catch (RuntimeException e) {
                log.error("Auto-start failed, engine stays STOPPED: {}", e.getMessage());
            }
        }

        log.info(
                "Recovery sequence completed in {}ms: activePositions={}, pendingExecutions={}, phase={}, autoStart={}",
                System.currentTimeMillis() - startedAt,
                positionLedger.activePositions().size(),
                positionLedger.pendingCount(),
                phase.getPhase(),
                engineProperties.isAutoStart());
    }
}
