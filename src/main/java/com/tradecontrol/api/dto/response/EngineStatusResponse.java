package com.tradecontrol.api.dto.response;

import com.tradecontrol.domain.enums.DegradationLevel;
import com.tradecontrol.domain.enums.EngineState;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Operator view of the engine. {@code lastTickAgeMs} counts from startup until the first tick. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineStatusResponse {

    private EngineState state;
    private DegradationLevel degradation;
    private String reason;
    private Instant since;
    private boolean scheduled;
    private boolean tickInFlight;
    private long skippedTicks;
    private long lastTickAgeMs;
    private int restartAttempts;
    private boolean acceptingSignals;
    private int queuedSignals;
    private int openPositions;
    private int pendingExecutions;
    private BigDecimal peakEquity;
}
