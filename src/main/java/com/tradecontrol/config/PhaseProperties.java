package com.tradecontrol.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Phase controller cadence, per-phase sample-size gates and decision thresholds.
 *
 * <p>Properties prefix: {@code tradecontrol.phase.*}. The highest phase is
 * {@code minTrades.size() - 1}; phase 0 has no sample-size requirement.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradecontrol.phase")
public class PhaseProperties {

    private Duration evaluationPeriod = Duration.ofMinutes(5);
    private List<Integer> minTrades = new ArrayList<>(List.of(0, 50, 200, 500, 1000));

    /** Number of most recent closed positions scored per evaluation. Sample gates count all of them. */
    private int windowSize = 500;

    private double advanceThreshold = 0.75;
    private double softAdvanceThreshold = 0.60;
    private double softAdvanceWinRate = 0.45;

    /** Soft advance needs at least this fraction of the next phase's minimum sample. */
    private double softAdvanceSampleFraction = 0.8;

    private double revertThreshold = 0.35;
    private double forceRevertAvgPnl = -0.05;
    private int forceRevertMinSample = 20;
    private boolean autoMode = true;

    public int maxPhase() {
        return minTrades.size() - 1;
    }

    public int minTradesFor(int phase) {
        if (phase <= 0) {
            return 0;
        }
        return minTrades.get(Math.min(phase, maxPhase()));
    }
}
