package com.tradecontrol.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Current aggressiveness phase. Written only by the phase controller. */
@Value
@Builder(toBuilder = true)
public class PhaseState {

    int phase;
    double readiness;
    boolean manualOverride;
    PerformanceMetrics metrics;
    Instant evaluatedAt;

    public static PhaseState initial(Instant now) {
        return PhaseState.builder()
                .phase(0)
                .readiness(0.0)
                .manualOverride(false)
                .metrics(PerformanceMetrics.empty())
                .evaluatedAt(now)
                .build();
    }
}
