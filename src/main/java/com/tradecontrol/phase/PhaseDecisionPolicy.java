package com.tradecontrol.phase;

import com.tradecontrol.config.PhaseProperties;
import com.tradecontrol.domain.enums.PhaseAction;
import com.tradecontrol.domain.model.PerformanceMetrics;
import com.tradecontrol.domain.model.ReadinessReport;
import org.springframework.stereotype.Component;

/**
 * Turns a readiness report into a phase transition. Every transition is a single step
 * except the force revert, which drops straight to phase 0.
 *
 * <p>Evaluation order:
 * <ol>
 *   <li>force revert: average return below {@code forceRevertAvgPnl} over more than
 *       {@code forceRevertMinSample} positions overrides everything else</li>
 *   <li>advance: readiness at least {@code advanceThreshold} and the completed positions meet
 *       the next phase's minimum</li>
 *   <li>soft advance: readiness at least {@code softAdvanceThreshold}, recent win rate at least
 *       {@code softAdvanceWinRate}, and the completed positions meet
 *       {@code softAdvanceSampleFraction} of the next phase's minimum</li>
 *   <li>revert: readiness below {@code revertThreshold} above phase 0</li>
 * </ol>
 *
 * <p>The force revert looks at the metrics window. The advance gates count every completed
 * position, since the window is capped at {@code windowSize}.
 */
@Component
public class PhaseDecisionPolicy {

    private final PhaseProperties phaseProperties;

    public PhaseDecisionPolicy(PhaseProperties phaseProperties) {
        this.phaseProperties = phaseProperties;
    }

    public PhaseDecision decide(
            int currentPhase, ReadinessReport report, PerformanceMetrics metrics, long completedTrades) {
        double readiness = report.getReadiness();
        int sample = metrics.getTotalTrades();

        if (currentPhase > 0
                && sample > phaseProperties.getForceRevertMinSample()
                && metrics.getAverageReturn() < phaseProperties.getForceRevertAvgPnl()) {
            return new PhaseDecision(
                    PhaseAction.FORCE_REVERT,
                    currentPhase,
                    0,
                    String.format(
                            "Average return %.4f over %d positions is below %.4f",
                            metrics.getAverageReturn(), sample, phaseProperties.getForceRevertAvgPnl()));
        }

        if (currentPhase < phaseProperties.maxPhase()) {
            int next = currentPhase + 1;
            int required = phaseProperties.minTradesFor(next);

            if (readiness >= phaseProperties.getAdvanceThreshold() && completedTrades >= required) {
                return new PhaseDecision(
                        PhaseAction.ADVANCE,
                        currentPhase,
                        next,
                        String.format("Readiness %.2f with %d/%d positions", readiness, completedTrades, required));
            }

            if (readiness >= phaseProperties.getSoftAdvanceThreshold()
                    && metrics.getRecentWinRate() >= phaseProperties.getSoftAdvanceWinRate()
                    && completedTrades >= required * phaseProperties.getSoftAdvanceSampleFraction()) {
                return new PhaseDecision(
                        PhaseAction.ADVANCE,
                        currentPhase,
                        next,
                        String.format(
                                "Readiness %.2f with recent win rate %.2f",
                                readiness, metrics.getRecentWinRate()));
            }
        }

        if (currentPhase > 0 && readiness < phaseProperties.getRevertThreshold()) {
            return new PhaseDecision(
                    PhaseAction.REVERT,
                    currentPhase,
                    currentPhase - 1,
                    String.format("Readiness %.2f below %.2f", readiness, phaseProperties.getRevertThreshold()));
        }

        return PhaseDecision.maintain(currentPhase, String.format("Readiness %.2f", readiness));
    }
}
