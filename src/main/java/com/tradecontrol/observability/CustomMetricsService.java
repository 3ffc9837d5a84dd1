package com.tradecontrol.observability;

import com.tradecontrol.domain.enums.EngineState;
import com.tradecontrol.engine.ControlLoop;
import com.tradecontrol.engine.EngineStateHolder;
import com.tradecontrol.engine.HeartbeatSupervisor;
import com.tradecontrol.event.EngineEventChannel;
import com.tradecontrol.event.EngineStateEvent;
import com.tradecontrol.event.PhaseEvent;
import com.tradecontrol.event.PositionEvent;
import com.tradecontrol.event.PositionEventType;
import com.tradecontrol.event.RiskEvent;
import com.tradecontrol.event.RiskEventType;
import com.tradecontrol.ledger.PositionLedger;
import com.tradecontrol.phase.PhaseController;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates custom Micrometer metrics for the trade control core.
 *
 * <ul>
 *   <li><b>positions.opened</b>, <b>positions.closed</b>, <b>positions.close.failed</b> (counters)</li>
 *   <li><b>signals.rejected</b> (counter, tagged by rejection reason)</li>
 *   <li><b>engine.emergency.shutdowns</b> (counter)</li>
 *   <li><b>phase.transitions</b> (counter, tagged by action)</li>
 *   <li><b>engine.ticks.skipped</b>, <b>engine.events.dropped</b> (function counters)</li>
 *   <li><b>positions.open</b>, <b>executions.pending</b>, <b>engine.running</b>,
 *       <b>engine.restart.attempts</b>, <b>phase.current</b>, <b>phase.readiness</b> (gauges)</li>
 * </ul>
 *
 * <p>Gauges are evaluated by Micrometer on scrape. Counters are driven by the events drained
 * from {@link EngineEventChannel}.
 */
@Service
public class CustomMetricsService {

    private static final Logger log = LoggerFactory.getLogger(CustomMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Counter positionsOpenedCounter;
    private final Counter positionsClosedCounter;
    private final Counter closeFailedCounter;
    private final Counter emergencyShutdownCounter;

    public CustomMetricsService(
            MeterRegistry meterRegistry,
            PositionLedger positionLedger,
            EngineStateHolder engineStateHolder,
            ControlLoop controlLoop,
            HeartbeatSupervisor heartbeatSupervisor,
            PhaseController phaseController,
            EngineEventChannel engineEventChannel) {
        this.meterRegistry = meterRegistry;

        this.positionsOpenedCounter = Counter.builder("positions.opened")
                .description("Positions opened from confirmed entry fills")
                .register(meterRegistry);

        this.positionsClosedCounter = Counter.builder("positions.closed")
                .description("Positions closed from confirmed exit fills")
                .register(meterRegistry);

        this.closeFailedCounter = Counter.builder("positions.close.failed")
                .description("Exit orders rejected or cancelled by the venue")
                .register(meterRegistry);

        this.emergencyShutdownCounter = Counter.builder("engine.emergency.shutdowns")
                .description("Transitions into EMERGENCY_STOPPED")
                .register(meterRegistry);

        FunctionCounter.builder("engine.ticks.skipped", controlLoop, ControlLoop::getSkippedTicks)
                .description("Control loop ticks skipped because the previous tick was still running")
                .register(meterRegistry);

        FunctionCounter.builder("engine.events.dropped", engineEventChannel, EngineEventChannel::getDroppedCount)
                .description("Events dropped from the full event channel")
                .register(meterRegistry);

        // Gauges
        meterRegistry.gauge("positions.open", positionLedger, ledger -> ledger.activePositions()
                .size());
        meterRegistry.gauge("executions.pending", positionLedger, PositionLedger::pendingCount);
        meterRegistry.gauge(
                "engine.running", engineStateHolder, holder -> holder.state() == EngineState.RUNNING ? 1.0 : 0.0);
        meterRegistry.gauge("engine.restart.attempts", heartbeatSupervisor, HeartbeatSupervisor::getRestartAttempts);
        meterRegistry.gauge("phase.current", phaseController, PhaseController::currentPhase);
        meterRegistry.gauge("phase.readiness", phaseController, controller -> controller.currentState()
                .getReadiness());
    }

    @EventListener
    @Order(20)
    public void onPositionEvent(PositionEvent event) {
        if (event.getEventType() == PositionEventType.OPENED) {
            positionsOpenedCounter.increment();
        } else if (event.getEventType() == PositionEventType.CLOSED) {
            positionsClosedCounter.increment();
        } else if (event.getEventType() == PositionEventType.CLOSE_FAILED) {
            closeFailedCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.SIGNAL_REJECTED && event.getReason() != null) {
            meterRegistry
                    .counter("signals.rejected", "reason", event.getReason().name())
                    .increment();
        }
    }

    @EventListener
    @Order(20)
    public void onEngineStateEvent(EngineStateEvent event) {
        if (event.isEmergency()) {
            emergencyShutdownCounter.increment();
            log.debug("Emergency shutdown counted: {}", event.getReason());
        }
    }

    @EventListener
    @Order(20)
    public void onPhaseEvent(PhaseEvent event) {
        meterRegistry
                .counter("phase.transitions", "action", event.getAction().name())
                .increment();
    }
}
