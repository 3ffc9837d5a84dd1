package com.tradecontrol.unit.phase;

import static com.tradecontrol.support.TestFixtures.NOW;
import static com.tradecontrol.support.TestFixtures.closedPosition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.tradecontrol.domain.enums.PositionSide;
import com.tradecontrol.domain.model.PerformanceMetrics;
import com.tradecontrol.domain.model.Position;
import com.tradecontrol.phase.PerformanceMetricsCalculator;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PerformanceMetricsCalculatorTest {

    private final PerformanceMetricsCalculator calculator = new PerformanceMetricsCalculator();

    private static List<Position> withPnls(String... pnls) {
        List<Position> positions = new ArrayList<>();
        for (int i = 0; i < pnls.length; i++) {
            positions.add(closedPosition(
                    "P-" + i, "BTCUSD", PositionSide.LONG, pnls[i], "momentum",
                    NOW.minusSeconds(3600L * (pnls.length - i) + 60), NOW.minusSeconds(3600L * (pnls.length - i))));
        }
        return positions;
    }

    @Test
    @DisplayName("No closed positions yields empty metrics")
    void empty() {
        PerformanceMetrics metrics = calculator.calculate(List.of());

        assertThat(metrics.getTotalTrades()).isZero();
        assertThat(metrics.getWinRate()).isZero();
    }

    @Test
    @DisplayName("Win rate, profit factor, returns, Sharpe and drawdown from a mixed sequence")
    void mixedSequence() {
        PerformanceMetrics metrics = calculator.calculate(withPnls("10", "-5", "10", "-5"));

        assertThat(metrics.getTotalTrades()).isEqualTo(4);
        assertThat(metrics.getWinningTrades()).isEqualTo(2);
        assertThat(metrics.getWinRate()).isEqualTo(0.5);
        assertThat(metrics.getProfitFactor()).isCloseTo(2.0, within(1e-9));
        assertThat(metrics.getAverageReturn()).isCloseTo(0.025, within(1e-9));
        assertThat(metrics.getSharpeRatio()).isCloseTo(0.025 / 0.075 * Math.sqrt(252), within(1e-6));
        assertThat(metrics.getMaxDrawdown()).isCloseTo(0.5, within(1e-9));
        assertThat(metrics.getConsistency()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("Gains without losses report the unbounded profit factor")
    void noLosses() {
        PerformanceMetrics metrics = calculator.calculate(withPnls("4", "6"));

        assertThat(metrics.getProfitFactor()).isEqualTo(999.0);
        assertThat(metrics.getMaxDrawdown()).isZero();
    }

    @Test
    @DisplayName("Recent win rate looks at the last 20 positions only")
    void recentWindow() {
        String[] pnls = new String[25];
        for (int i = 0; i < 25; i++) {
            pnls[i] = i < 5 ? "-1" : "1";
        }

        PerformanceMetrics metrics = calculator.calculate(withPnls(pnls));

        assertThat(metrics.getWinRate()).isCloseTo(0.8, within(1e-9));
        assertThat(metrics.getRecentWinRate()).isEqualTo(1.0);
        assertThat(metrics.getConsistency()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    @DisplayName("Break-even positions count neither as wins nor as losses")
    void breakEven() {
        PerformanceMetrics metrics = calculator.calculate(withPnls("0", "3"));

        assertThat(metrics.getWinningTrades()).isEqualTo(1);
        assertThat(metrics.getWinRate()).isEqualTo(0.5);
        assertThat(metrics.getProfitFactor()).isEqualTo(999.0);
    }
}
