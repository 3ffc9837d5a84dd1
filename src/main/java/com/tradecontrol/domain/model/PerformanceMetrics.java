package com.tradecontrol.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rolling performance over closed positions. Returns are per-position P&L divided by
 * entry notional. Persisted as JSON inside the phase state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceMetrics {

    private int totalTrades;
    private int winningTrades;
    private double winRate;

    /** Win rate of the most recent trades (last 20). */
    private double recentWinRate;

    private double averageReturn;
    private double profitFactor;
    private double sharpeRatio;

    /** Peak-to-trough decline of cumulative return, as a fraction. */
    private double maxDrawdown;

    /** 1 - |overall win rate - recent win rate|. */
    private double consistency;

    public static PerformanceMetrics empty() {
        return new PerformanceMetrics();
    }
}
