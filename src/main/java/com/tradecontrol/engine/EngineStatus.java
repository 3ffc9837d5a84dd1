package com.tradecontrol.engine;

import com.tradecontrol.domain.enums.DegradationLevel;
import com.tradecontrol.domain.enums.EngineState;
import java.time.Instant;
import lombok.Value;

/** Immutable snapshot of engine state with the reason for the last change. */
@Value
public class EngineStatus {

    EngineState state;
    DegradationLevel degradation;
    String reason;
    Instant since;

    public boolean isRunning() {
        return state == EngineState.RUNNING;
    }

    public boolean isDegraded() {
        return degradation == DegradationLevel.DEGRADED;
    }
}
