package com.tradecontrol.phase;

import com.tradecontrol.domain.enums.PhaseAction;
import lombok.Value;

@Value
public class PhaseDecision {

    PhaseAction action;
    int currentPhase;
    int targetPhase;
    String reason;

    public boolean changesPhase() {
        return targetPhase != currentPhase;
    }

    static PhaseDecision maintain(int phase, String reason) {
        return new PhaseDecision(PhaseAction.MAINTAIN, phase, phase, reason);
    }
}
