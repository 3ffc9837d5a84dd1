package com.tradecontrol.engine;

import com.tradecontrol.domain.enums.DegradationLevel;
import com.tradecontrol.domain.enums.EngineState;
import com.tradecontrol.event.EventPublisherHelper;
import com.tradecontrol.exception.EngineStateException;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the canonical {@link EngineState}. Only the control loop and the heartbeat supervisor
 * write it; everything else reads {@link #current()} snapshots.
 *
 * <p>EMERGENCY_STOPPED is left only through {@link #rearm}, which lands in STOPPED. No other
 * method moves the engine out of it.
 */
@Component
public class EngineStateHolder {

    private static final Logger log = LoggerFactory.getLogger(EngineStateHolder.class);

    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;
    private final AtomicReference<EngineStatus> status;

    public EngineStateHolder(EventPublisherHelper eventPublisherHelper, Clock clock) {
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        this.status = new AtomicReference<>(
                new EngineStatus(EngineState.STOPPED, DegradationLevel.NONE, "Initial state", clock.instant()));
    }

    public EngineStatus current() {
        return status.get();
    }

    public EngineState state() {
        return status.get().getState();
    }

    /** STOPPED -> RUNNING. */
    public void markRunning(String reason) {
        EngineStatus previous = status.get();
        if (previous.getState() != EngineState.STOPPED) {
            throw new EngineStateException("Engine can only start from STOPPED", previous.getState());
        }
        if (!status.compareAndSet(previous, next(EngineState.RUNNING, DegradationLevel.NONE, reason))) {
            throw new EngineStateException("Engine state changed concurrently", status.get().getState());
        }
        publish(previous);
        log.info("Engine RUNNING: {}", reason);
    }

    /** RUNNING -> STOPPED. No-op when already STOPPED; refuses to leave EMERGENCY_STOPPED. */
    public void markStopped(String reason) {
        EngineStatus previous = status.get();
        if (previous.getState() == EngineState.EMERGENCY_STOPPED) {
            throw new EngineStateException("Engine is emergency-stopped; re-arm instead", previous.getState());
        }
        if (previous.getState() == EngineState.STOPPED) {
            return;
        }
        if (status.compareAndSet(previous, next(EngineState.STOPPED, DegradationLevel.NONE, reason))) {
            publish(previous);
            log.info("Engine STOPPED: {}", reason);
        }
    }

    /**
     * Any state -> EMERGENCY_STOPPED.
     *
     * @return false when the engine was already emergency-stopped
     */
    public boolean enterEmergency(String reason) {
        EngineStatus previous = status.getAndUpdate(current -> current.getState() == EngineState.EMERGENCY_STOPPED
                ? current
                : next(EngineState.EMERGENCY_STOPPED, current.getDegradation(), reason));
        if (previous.getState() == EngineState.EMERGENCY_STOPPED) {
            return false;
        }
        publish(previous);
        log.error("Engine EMERGENCY_STOPPED: {}", reason);
        return true;
    }

    /** EMERGENCY_STOPPED -> STOPPED. The only way out of an emergency stop. */
    public void rearm(String reason) {
        EngineStatus previous = status.get();
        if (previous.getState() != EngineState.EMERGENCY_STOPPED) {
            throw new EngineStateException("Re-arm is only valid after an emergency stop", previous.getState());
        }
        if (status.compareAndSet(previous, next(EngineState.STOPPED, DegradationLevel.NONE, reason))) {
            publish(previous);
            log.warn("Engine re-armed: {}", reason);
        }
    }

    /** Sets DEGRADED while RUNNING. Returns true on a change. */
    public boolean markDegraded(String reason) {
        return setDegradation(DegradationLevel.DEGRADED, reason);
    }

    public boolean clearDegraded(String reason) {
        return setDegradation(DegradationLevel.NONE, reason);
    }

    private boolean setDegradation(DegradationLevel level, String reason) {
        EngineStatus previous = status.get();
        if (previous.getState() != EngineState.RUNNING || previous.getDegradation() == level) {
            return false;
        }
        if (!status.compareAndSet(previous, next(EngineState.RUNNING, level, reason))) {
            return false;
        }
        publish(previous);
        if (level == DegradationLevel.DEGRADED) {
            log.warn("Engine DEGRADED: {}", reason);
        } else {
            log.info("Engine recovered from DEGRADED: {}", reason);
        }
        return true;
    }

    private EngineStatus next(EngineState state, DegradationLevel degradation, String reason) {
        return new EngineStatus(state, degradation, reason, clock.instant());
    }

    private void publish(EngineStatus previous) {
        EngineStatus current = status.get();
        eventPublisherHelper.publishEngineState(
                this, previous.getState(), current.getState(), current.getDegradation(), current.getReason());
    }
}
