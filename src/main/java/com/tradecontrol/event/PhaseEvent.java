package com.tradecontrol.event;

import com.tradecontrol.domain.enums.PhaseAction;
import org.springframework.context.ApplicationEvent;

/** Published when an evaluation or an operator override changes the phase. */
public class PhaseEvent extends ApplicationEvent {

    private final int previousPhase;
    private final int newPhase;
    private final double readiness;
    private final PhaseAction action;

    public PhaseEvent(Object source, int previousPhase, int newPhase, double readiness, PhaseAction action) {
        super(source);
        this.previousPhase = previousPhase;
        this.newPhase = newPhase;
        this.readiness = readiness;
        this.action = action;
    }

    public int getPreviousPhase() {
        return previousPhase;
    }

    public int getNewPhase() {
        return newPhase;
    }

    public double getReadiness() {
        return readiness;
    }

    public PhaseAction getAction() {
        return action;
    }
}
