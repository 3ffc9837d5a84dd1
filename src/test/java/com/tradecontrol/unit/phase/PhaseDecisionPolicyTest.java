package com.tradecontrol.unit.phase;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradecontrol.config.PhaseProperties;
import com.tradecontrol.domain.enums.PhaseAction;
import com.tradecontrol.domain.model.PerformanceMetrics;
import com.tradecontrol.domain.model.ReadinessReport;
import com.tradecontrol.phase.PhaseDecision;
import com.tradecontrol.phase.PhaseDecisionPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PhaseDecisionPolicy. Default minimum samples per phase: 0, 50, 200, 500, 1000.
 */
class PhaseDecisionPolicyTest {

    private final PhaseDecisionPolicy policy = new PhaseDecisionPolicy(new PhaseProperties());

    private static ReadinessReport readiness(double value) {
        return ReadinessReport.builder().readiness(value).build();
    }

    private static PerformanceMetrics sample(int total, double recentWinRate, double averageReturn) {
        return PerformanceMetrics.builder()
                .totalTrades(total)
                .recentWinRate(recentWinRate)
                .averageReturn(averageReturn)
                .build();
    }

    @Nested
    @DisplayName("Advance")
    class Advance {

        @Test
        @DisplayName("High readiness with the next phase's sample advances exactly one phase")
        void advancesOneStep() {
            PhaseDecision decision = policy.decide(1, readiness(0.80), sample(240, 0.5, 0.01), 240);

            assertThat(decision.getAction()).isEqualTo(PhaseAction.ADVANCE);
            assertThat(decision.getTargetPhase()).isEqualTo(2);
            assertThat(decision.changesPhase()).isTrue();
        }

        @Test
        @DisplayName("High readiness without enough sample and a weak recent win rate maintains")
        void sampleGate() {
            PhaseDecision decision = policy.decide(1, readiness(0.90), sample(150, 0.30, 0.01), 150);

            assertThat(decision.getAction()).isEqualTo(PhaseAction.MAINTAIN);
            assertThat(decision.getTargetPhase()).isEqualTo(1);
        }

        @Test
        @DisplayName("Soft advance needs 80% of the next phase's sample and a decent recent win rate")
        void softAdvance() {
            assertThat(policy.decide(1, readiness(0.65), sample(160, 0.50, 0.01), 160).getAction())
                    .isEqualTo(PhaseAction.ADVANCE);
            assertThat(policy.decide(1, readiness(0.65), sample(159, 0.50, 0.01), 159).getAction())
                    .isEqualTo(PhaseAction.MAINTAIN);
            assertThat(policy.decide(1, readiness(0.65), sample(160, 0.40, 0.01), 160).getAction())
                    .isEqualTo(PhaseAction.MAINTAIN);
        }

        @Test
        @DisplayName("Sample gates count every completed position, not just the metrics window")
        void completedTradesBeyondWindow() {
            PerformanceMetrics window = sample(500, 0.5, 0.01);

            assertThat(policy.decide(3, readiness(0.80), window, 1200).getTargetPhase()).isEqualTo(4);
            assertThat(policy.decide(3, readiness(0.80), window, 500).getAction()).isEqualTo(PhaseAction.MAINTAIN);
            assertThat(policy.decide(3, readiness(0.65), window, 800).getTargetPhase()).isEqualTo(4);
        }

        @Test
        @DisplayName("The highest phase never advances")
        void maxPhase() {
            PhaseDecision decision = policy.decide(4, readiness(0.95), sample(5000, 0.9, 0.02), 5000);

            assertThat(decision.getAction()).isEqualTo(PhaseAction.MAINTAIN);
            assertThat(decision.getTargetPhase()).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("Revert")
    class Revert {

        @Test
        @DisplayName("Low readiness above phase 0 reverts one phase")
        void revertsOneStep() {
            PhaseDecision decision = policy.decide(3, readiness(0.30), sample(600, 0.4, 0.0), 600);

            assertThat(decision.getAction()).isEqualTo(PhaseAction.REVERT);
            assertThat(decision.getTargetPhase()).isEqualTo(2);
        }

        @Test
        @DisplayName("Phase 0 never reverts")
        void floor() {
            assertThat(policy.decide(0, readiness(0.05), sample(10, 0.0, -0.2), 10).getTargetPhase()).isZero();
        }

        @Test
        @DisplayName("Sustained losses force a revert to phase 0 regardless of readiness")
        void forceRevert() {
            PhaseDecision decision = policy.decide(3, readiness(0.90), sample(21, 0.6, -0.06), 21);

            assertThat(decision.getAction()).isEqualTo(PhaseAction.FORCE_REVERT);
            assertThat(decision.getTargetPhase()).isZero();
        }

        @Test
        @DisplayName("Force revert needs more than the minimum sample")
        void forceRevertSampleGate() {
            PhaseDecision decision = policy.decide(3, readiness(0.50), sample(20, 0.6, -0.06), 20);

            assertThat(decision.getAction()).isEqualTo(PhaseAction.MAINTAIN);
        }
    }
}
