package com.tradecontrol.phase;

import com.tradecontrol.config.PhaseProperties;
import com.tradecontrol.domain.enums.PositionSide;
import com.tradecontrol.domain.model.PerformanceMetrics;
import com.tradecontrol.domain.model.Position;
import com.tradecontrol.domain.model.ReadinessReport;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Combines five normalized sub-scores into a readiness score in [0, 1].
 *
 * <table>
 *   <tr><th>Sub-score</th><th>Weight</th><th>Measures</th></tr>
 *   <tr><td>data volume</td><td>0.25</td><td>closed positions vs. the next phase's minimum</td></tr>
 *   <tr><td>stability</td><td>0.30</td><td>win rate in a healthy band, consistency, bounded drawdown</td></tr>
 *   <tr><td>trajectory</td><td>0.20</td><td>win rate of the second half vs. the first half of the last 7 days</td></tr>
 *   <tr><td>risk quality</td><td>0.15</td><td>profit factor, Sharpe-like ratio, positive average return</td></tr>
 *   <tr><td>diversity</td><td>0.10</td><td>spread over strategies, hours of day, long/short and symbols</td></tr>
 * </table>
 */
@Component
public class ReadinessScorer {

    static final double VOLUME_WEIGHT = 0.25;
    static final double STABILITY_WEIGHT = 0.30;
    static final double TRAJECTORY_WEIGHT = 0.20;
    static final double RISK_WEIGHT = 0.15;
    static final double DIVERSITY_WEIGHT = 0.10;

    static final Duration TRAJECTORY_WINDOW = Duration.ofDays(7);
    static final int TRAJECTORY_MIN_SAMPLE = 10;

    private final PhaseProperties phaseProperties;
    private final Clock clock;

    public ReadinessScorer(PhaseProperties phaseProperties, Clock clock) {
        this.phaseProperties = phaseProperties;
        this.clock = clock;
    }

    /**
     * @param completedTrades every position closed so far, not only those in the metrics window
     */
    public ReadinessReport score(
            PerformanceMetrics metrics, List<Position> closedOldestFirst, int currentPhase, long completedTrades) {
        double volume = dataVolume(completedTrades, currentPhase);
        double stability = stability(metrics);
        double trajectory = trajectory(closedOldestFirst);
        double risk = riskQuality(metrics);
        double diversity = diversity(closedOldestFirst);

        double readiness = volume * VOLUME_WEIGHT
                + stability * STABILITY_WEIGHT
                + trajectory * TRAJECTORY_WEIGHT
                + risk * RISK_WEIGHT
                + diversity * DIVERSITY_WEIGHT;

        return ReadinessReport.builder()
                .dataVolume(volume)
                .stability(stability)
                .trajectory(trajectory)
                .riskQuality(risk)
                .diversity(diversity)
                .readiness(clamp(readiness))
                .build();
    }

    double dataVolume(long completedTrades, int currentPhase) {
        int target = phaseProperties.minTradesFor(Math.min(currentPhase + 1, phaseProperties.maxPhase()));
        if (target <= 0) {
            return 1.0;
        }
        return Math.min(1.0, (double) completedTrades / target);
    }

    double stability(PerformanceMetrics metrics) {
        if (metrics.getTotalTrades() == 0) {
            return 0.0;
        }
        double score = 0.0;
        double winRate = metrics.getWinRate();
        if (winRate >= 0.35 && winRate <= 0.65) {
            score += 0.4;
        } else if (winRate >= 0.30 && winRate <= 0.70) {
            score += 0.2;
        }
        score += metrics.getConsistency() * 0.3;
        if (metrics.getMaxDrawdown() < 0.20) {
            score += 0.3;
        } else if (metrics.getMaxDrawdown() < 0.30) {
            score += 0.15;
        }
        return Math.min(1.0, score);
    }

    double trajectory(List<Position> closedOldestFirst) {
        Instant cutoff = clock.instant().minus(TRAJECTORY_WINDOW);
        List<Position> recent = closedOldestFirst.stream()
                .filter(p -> p.getClosedAt() != null && !p.getClosedAt().isBefore(cutoff))
                .collect(Collectors.toList());
        if (recent.size() < TRAJECTORY_MIN_SAMPLE) {
            return 0.5;
        }
        int mid = recent.size() / 2;
        double first = PerformanceMetricsCalculator.winRate(recent.subList(0, mid));
        double second = PerformanceMetricsCalculator.winRate(recent.subList(mid, recent.size()));
        return clamp(0.5 + (second - first));
    }

    double riskQuality(PerformanceMetrics metrics) {
        double score = 0.0;
        if (metrics.getProfitFactor() > 1.5) {
            score += 0.4;
        } else if (metrics.getProfitFactor() > 1.2) {
            score += 0.3;
        } else if (metrics.getProfitFactor() > 1.0) {
            score += 0.2;
        }
        if (metrics.getSharpeRatio() > 1.0) {
            score += 0.3;
        } else if (metrics.getSharpeRatio() > 0.5) {
            score += 0.2;
        } else if (metrics.getSharpeRatio() > 0) {
            score += 0.1;
        }
        if (metrics.getAverageReturn() > 0) {
            score += 0.3;
        }
        return Math.min(1.0, score);
    }

    double diversity(List<Position> closed) {
        if (closed.isEmpty()) {
            return 0.0;
        }
        long strategies = closed.stream()
                .map(Position::getStrategyId)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        long hours = closed.stream()
                .map(Position::getOpenedAt)
                .filter(Objects::nonNull)
                .map(at -> at.atZone(ZoneOffset.UTC).getHour())
                .distinct()
                .count();
        long symbols = closed.stream().map(Position::getSymbol).distinct().count();
        double longShare = (double) closed.stream().filter(p -> p.getSide() == PositionSide.LONG).count()
                / closed.size();

        double score = Math.min(0.25, strategies / 4.0 * 0.25);
        score += Math.min(0.25, hours / 12.0 * 0.25);
        score += (1.0 - Math.abs(0.5 - longShare) * 2.0) * 0.25;
        score += Math.min(0.25, symbols / 3.0 * 0.25);
        return Math.min(1.0, score);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
