package com.tradecontrol.phase;

import com.tradecontrol.domain.model.PerformanceMetrics;
import com.tradecontrol.domain.model.Position;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Derives rolling performance metrics from closed positions.
 *
 * <p>Input is expected oldest first. A position's return is its realized P&L divided by its
 * entry notional, so positions of different sizes weigh equally in win rate, average return
 * and the Sharpe-like ratio. Profit factor and drawdown work on absolute P&L.
 */
@Component
public class PerformanceMetricsCalculator {

    static final int RECENT_WINDOW = 20;
    static final double TRADING_DAYS_PER_YEAR = 252.0;

    /** Profit factor reported when there are gains but no losses. */
    static final double UNBOUNDED_PROFIT_FACTOR = 999.0;

    public PerformanceMetrics calculate(List<Position> closedOldestFirst) {
        int total = closedOldestFirst.size();
        if (total == 0) {
            return PerformanceMetrics.empty();
        }

        List<Double> pnls = new ArrayList<>(total);
        List<Double> returns = new ArrayList<>(total);
        for (Position position : closedOldestFirst) {
            double pnl = pnlOf(position);
            pnls.add(pnl);
            returns.add(returnOf(position, pnl));
        }

        int wins = 0;
        double grossProfit = 0.0;
        double grossLoss = 0.0;
        for (double pnl : pnls) {
            if (pnl > 0) {
                wins++;
                grossProfit += pnl;
            } else if (pnl < 0) {
                grossLoss += -pnl;
            }
        }
        double winRate = (double) wins / total;

        double profitFactor;
        if (grossLoss > 0) {
            profitFactor = grossProfit / grossLoss;
        } else {
            profitFactor = grossProfit > 0 ? UNBOUNDED_PROFIT_FACTOR : 0.0;
        }

        double averageReturn = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = returns.stream()
                .mapToDouble(r -> (r - averageReturn) * (r - averageReturn))
                .average()
                .orElse(0.0);
        double stdDev = Math.sqrt(variance);
        double sharpe = stdDev > 0 ? averageReturn / stdDev * Math.sqrt(TRADING_DAYS_PER_YEAR) : 0.0;

        double recentWinRate = recentWinRate(pnls);

        return PerformanceMetrics.builder()
                .totalTrades(total)
                .winningTrades(wins)
                .winRate(winRate)
                .recentWinRate(recentWinRate)
                .averageReturn(averageReturn)
                .profitFactor(profitFactor)
                .sharpeRatio(sharpe)
                .maxDrawdown(maxDrawdown(pnls))
                .consistency(1.0 - Math.abs(winRate - recentWinRate))
                .build();
    }

    /** Win rate of the positions in {@code closedOldestFirst}, 0 for an empty list. */
    static double winRate(List<Position> closedOldestFirst) {
        if (closedOldestFirst.isEmpty()) {
            return 0.0;
        }
        long wins = closedOldestFirst.stream().filter(p -> pnlOf(p) > 0).count();
        return (double) wins / closedOldestFirst.size();
    }

    static double pnlOf(Position position) {
        return position.getRealizedPnl() != null ? position.getRealizedPnl().doubleValue() : 0.0;
    }

    private double returnOf(Position position, double pnl) {
        BigDecimal notional = position.getEntryPrice() != null && position.getQuantity() != null
                ? position.getEntryPrice().multiply(position.getQuantity(), MathContext.DECIMAL64)
                : BigDecimal.ZERO;
        if (notional.signum() <= 0) {
            return 0.0;
        }
        return pnl / notional.doubleValue();
    }

    private double recentWinRate(List<Double> pnls) {
        List<Double> recent = pnls.subList(Math.max(0, pnls.size() - RECENT_WINDOW), pnls.size());
        long wins = recent.stream().filter(pnl -> pnl > 0).count();
        return (double) wins / recent.size();
    }

    private double maxDrawdown(List<Double> pnls) {
        double running = 0.0;
        double peak = 0.0;
        double maxDrawdown = 0.0;
        for (double pnl : pnls) {
            running += pnl;
            peak = Math.max(peak, running);
            if (peak > 0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - running) / peak);
            }
        }
        return maxDrawdown;
    }
}
