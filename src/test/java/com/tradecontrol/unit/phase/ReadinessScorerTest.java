package com.tradecontrol.unit.phase;

import static com.tradecontrol.support.TestFixtures.NOW;
import static com.tradecontrol.support.TestFixtures.closedPosition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.tradecontrol.config.PhaseProperties;
import com.tradecontrol.domain.enums.PositionSide;
import com.tradecontrol.domain.model.PerformanceMetrics;
import com.tradecontrol.domain.model.Position;
import com.tradecontrol.domain.model.ReadinessReport;
import com.tradecontrol.phase.ReadinessScorer;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ReadinessScorer sub-scores and their weighted sum.
 */
class ReadinessScorerTest {

    private final ReadinessScorer scorer = new ReadinessScorer(new PhaseProperties(), Clock.fixed(NOW, ZoneOffset.UTC));

    private static PerformanceMetrics metrics(int total, double winRate, double consistency, double drawdown) {
        return PerformanceMetrics.builder()
                .totalTrades(total)
                .winRate(winRate)
                .recentWinRate(winRate)
                .consistency(consistency)
                .maxDrawdown(drawdown)
                .build();
    }

    private static Position closed(int i, boolean win, Duration ago) {
        return closedPosition(
                "P-" + i,
                "BTCUSD",
                PositionSide.LONG,
                win ? "1" : "-1",
                "momentum",
                NOW.minus(ago).minusSeconds(60),
                NOW.minus(ago));
    }

    @Nested
    @DisplayName("Sub-scores")
    class SubScores {

        @Test
        @DisplayName("Data volume measures the sample against the next phase's minimum")
        void dataVolume() {
            assertThat(scorer.score(metrics(25, 0.5, 1, 0), List.of(), 0, 25).getDataVolume())
                    .isCloseTo(0.5, within(1e-9));
            assertThat(scorer.score(metrics(120, 0.5, 1, 0), List.of(), 0, 120).getDataVolume())
                    .isEqualTo(1.0);
            assertThat(scorer.score(metrics(500, 0.5, 1, 0), List.of(), 4, 500).getDataVolume())
                    .isCloseTo(0.5, within(1e-9));
            assertThat(scorer.score(metrics(500, 0.5, 1, 0), List.of(), 4, 1200).getDataVolume())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Stability rewards a healthy win rate band, consistency and low drawdown")
        void stability() {
            assertThat(scorer.score(metrics(50, 0.5, 1.0, 0.1), List.of(), 0, 0).getStability())
                    .isCloseTo(1.0, within(1e-9));
            assertThat(scorer.score(metrics(50, 0.68, 0.5, 0.25), List.of(), 0, 0).getStability())
                    .isCloseTo(0.2 + 0.15 + 0.15, within(1e-9));
            assertThat(scorer.score(metrics(50, 0.9, 0.0, 0.5), List.of(), 0, 0).getStability())
                    .isZero();
        }

        @Test
        @DisplayName("Risk quality rewards profit factor, Sharpe and positive average return")
        void riskQuality() {
            PerformanceMetrics strong = PerformanceMetrics.builder()
                    .totalTrades(50).profitFactor(2.0).sharpeRatio(1.5).averageReturn(0.01).build();
            PerformanceMetrics weak = PerformanceMetrics.builder()
                    .totalTrades(50).profitFactor(1.1).sharpeRatio(0.3).averageReturn(-0.01).build();

            assertThat(scorer.score(strong, List.of(), 0, 0).getRiskQuality()).isCloseTo(1.0, within(1e-9));
            assertThat(scorer.score(weak, List.of(), 0, 0).getRiskQuality()).isCloseTo(0.3, within(1e-9));
        }

        @Test
        @DisplayName("Trajectory compares the second half of the last week with the first")
        void trajectoryImproving() {
            List<Position> closed = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                closed.add(closed(i, i >= 5, Duration.ofHours(20 - i)));
            }

            assertThat(scorer.score(metrics(10, 0.5, 1, 0), closed, 0, 10).getTrajectory()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Trajectory is neutral with fewer than ten positions in the last week")
        void trajectoryNeutral() {
            List<Position> closed = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                Duration ago = i < 4 ? Duration.ofDays(10) : Duration.ofHours(20 - i);
                closed.add(closed(i, i >= 6, ago));
            }

            assertThat(scorer.score(metrics(12, 0.5, 1, 0), closed, 0, 12).getTrajectory()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Diversity is full across strategies, hours, sides and symbols")
        void diversity() {
            List<Position> closed = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                closed.add(closedPosition(
                        "P-" + i,
                        "SYM" + (i % 3),
                        i % 2 == 0 ? PositionSide.LONG : PositionSide.SHORT,
                        "1",
                        "strategy-" + (i % 4),
                        NOW.minus(Duration.ofHours(12 - i)),
                        NOW.minus(Duration.ofHours(12 - i)).plusSeconds(60)));
            }

            assertThat(scorer.score(metrics(12, 1, 1, 0), closed, 0, 12).getDiversity()).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    @DisplayName("No history scores only the neutral trajectory")
    void noHistory() {
        ReadinessReport report = scorer.score(PerformanceMetrics.empty(), List.of(), 0, 0);

        assertThat(report.getDataVolume()).isZero();
        assertThat(report.getStability()).isZero();
        assertThat(report.getDiversity()).isZero();
        assertThat(report.getReadiness()).isCloseTo(0.5 * 0.20, within(1e-9));
    }
}
