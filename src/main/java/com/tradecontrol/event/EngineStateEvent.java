package com.tradecontrol.event;

import com.tradecontrol.domain.enums.DegradationLevel;
import com.tradecontrol.domain.enums.EngineState;
import org.springframework.context.ApplicationEvent;

/** Published on every engine state or degradation change. */
public class EngineStateEvent extends ApplicationEvent {

    private final EngineState previousState;
    private final EngineState newState;
    private final DegradationLevel degradation;
    private final String reason;

    public EngineStateEvent(
            Object source,
            EngineState previousState,
            EngineState newState,
            DegradationLevel degradation,
            String reason) {
        super(source);
        this.previousState = previousState;
        this.newState = newState;
        this.degradation = degradation;
        this.reason = reason;
    }

    public EngineState getPreviousState() {
        return previousState;
    }

    public EngineState getNewState() {
        return newState;
    }

    public DegradationLevel getDegradation() {
        return degradation;
    }

    public String getReason() {
        return reason;
    }

    public boolean isEmergency() {
        return newState == EngineState.EMERGENCY_STOPPED && previousState != EngineState.EMERGENCY_STOPPED;
    }
}
