package com.tradecontrol.phase;

import com.tradecontrol.config.PhaseProperties;
import com.tradecontrol.domain.enums.PhaseAction;
import com.tradecontrol.domain.model.PerformanceMetrics;
import com.tradecontrol.domain.model.PhaseState;
import com.tradecontrol.domain.model.Position;
import com.tradecontrol.domain.model.ReadinessReport;
import com.tradecontrol.event.EventPublisherHelper;
import com.tradecontrol.exception.BusinessException;
import com.tradecontrol.exception.ErrorCode;
import com.tradecontrol.persistence.TradeStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Adjusts the aggressiveness phase on its own cadence from the rolling window of closed
 * positions. Sole writer of {@link PhaseState}; everything else reads {@link #currentState()}.
 *
 * <p>Each evaluation persists the new state before publishing it, so a restart resumes from
 * the last evaluated phase. While a manual override is active the readiness snapshot is still
 * refreshed but the phase itself is left alone.
 */
@Service
public class PhaseController {

    private static final Logger log = LoggerFactory.getLogger(PhaseController.class);

    private final TradeStore tradeStore;
    private final PerformanceMetricsCalculator metricsCalculator;
    private final ReadinessScorer readinessScorer;
    private final PhaseDecisionPolicy decisionPolicy;
    private final PhaseStateStore phaseStateStore;
    private final PhaseProperties phaseProperties;
    private final EventPublisherHelper eventPublisherHelper;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private final AtomicReference<PhaseState> state;
    private final AtomicReference<ReadinessReport> lastReport = new AtomicReference<>(new ReadinessReport());
    private final AtomicReference<ScheduledFuture<?>> evaluationTask = new AtomicReference<>();

    public PhaseController(
            TradeStore tradeStore,
            PerformanceMetricsCalculator metricsCalculator,
            ReadinessScorer readinessScorer,
            PhaseDecisionPolicy decisionPolicy,
            PhaseStateStore phaseStateStore,
            PhaseProperties phaseProperties,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("engineScheduler") TaskScheduler taskScheduler,
            Clock clock) {
        this.tradeStore = tradeStore;
        this.metricsCalculator = metricsCalculator;
        this.readinessScorer = readinessScorer;
        this.decisionPolicy = decisionPolicy;
        this.phaseStateStore = phaseStateStore;
        this.phaseProperties = phaseProperties;
        this.eventPublisherHelper = eventPublisherHelper;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.state = new AtomicReference<>(PhaseState.initial(clock.instant()));
    }

    // ========================
    // LIFECYCLE
    // ========================

    /** Loads the persisted phase. Phases above the configured maximum are clamped. */
    public PhaseState restore() {
        PhaseState restored = phaseStateStore
                .load()
                .map(s -> s.getPhase() > phaseProperties.maxPhase()
                        ? s.toBuilder().phase(phaseProperties.maxPhase()).build()
                        : s)
                .orElseGet(() -> PhaseState.initial(clock.instant()));
        state.set(restored);
        log.info(
                "Phase state restored: phase={}, readiness={}, manualOverride={}",
                restored.getPhase(),
                String.format("%.2f", restored.getReadiness()),
                restored.isManualOverride());
        return restored;
    }

    public void start() {
        ScheduledFuture<?> future =
                taskScheduler.scheduleWithFixedDelay(this::evaluateSafely, phaseProperties.getEvaluationPeriod());
        ScheduledFuture<?> previous = evaluationTask.getAndSet(future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.info("Phase evaluation scheduled every {}", phaseProperties.getEvaluationPeriod());
    }

    public void stop() {
        ScheduledFuture<?> current = evaluationTask.getAndSet(null);
        if (current != null) {
            current.cancel(false);
        }
    }

    // ========================
    // EVALUATION
    // ========================

    /** One evaluation cycle. Synchronized against overrides so each cycle sees one phase. */
    public synchronized PhaseDecision evaluate() {
        PhaseState current = state.get();

        List<Position> closed = new ArrayList<>(tradeStore.findRecentClosedPositions(phaseProperties.getWindowSize()));
        Collections.reverse(closed);

        PerformanceMetrics metrics = metricsCalculator.calculate(closed);
        long completed = tradeStore.countClosedPositions();
        ReadinessReport report = readinessScorer.score(metrics, closed, current.getPhase(), completed);
        lastReport.set(report);

        PhaseDecision decision;
        if (current.isManualOverride() || !phaseProperties.isAutoMode()) {
            decision = new PhaseDecision(
                    PhaseAction.MANUAL, current.getPhase(), current.getPhase(), "Automatic evaluation suspended");
        } else {
            decision = decisionPolicy.decide(current.getPhase(), report, metrics, completed);
        }

        PhaseState next = current.toBuilder()
                .phase(decision.getTargetPhase())
                .readiness(report.getReadiness())
                .metrics(metrics)
                .evaluatedAt(clock.instant())
                .build();
        phaseStateStore.save(next);
        state.set(next);

        if (decision.changesPhase()) {
            log.info(
                    "Phase {} -> {} ({}): {}",
                    decision.getCurrentPhase(),
                    decision.getTargetPhase(),
                    decision.getAction(),
                    decision.getReason());
            eventPublisherHelper.publishPhase(
                    this, decision.getCurrentPhase(), decision.getTargetPhase(), report.getReadiness(), decision.getAction());
        } else {
            log.debug("Phase {} maintained: {}", current.getPhase(), decision.getReason());
        }
        return decision;
    }

    private void evaluateSafely() {
        try {
            evaluate();
        } catch (RuntimeException e) {
            log.error("Phase evaluation failed: {}", e.getMessage(), e);
        }
    }

    // ========================
    // MANUAL CONTROL
    // ========================

    /** Pins the phase and suspends automatic evaluation until {@link #resumeAutomatic()}. */
    public synchronized PhaseState overridePhase(int phase) {
        if (phase < 0 || phase > phaseProperties.maxPhase()) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Phase must be between 0 and " + phaseProperties.maxPhase(),
                    Map.of("phase", phase));
        }
        PhaseState current = state.get();
        PhaseState next = current.toBuilder()
                .phase(phase)
                .manualOverride(true)
                .evaluatedAt(clock.instant())
                .build();
        phaseStateStore.save(next);
        state.set(next);
        log.warn("Phase manually set {} -> {}", current.getPhase(), phase);
        if (current.getPhase() != phase) {
            eventPublisherHelper.publishPhase(this, current.getPhase(), phase, next.getReadiness(), PhaseAction.MANUAL);
        }
        return next;
    }

    public synchronized PhaseState resumeAutomatic() {
        PhaseState next = state.get().toBuilder().manualOverride(false).build();
        phaseStateStore.save(next);
        state.set(next);
        log.info("Automatic phase evaluation resumed at phase {}", next.getPhase());
        return next;
    }

    // ========================
    // READ SIDE
    // ========================

    public int currentPhase() {
        return state.get().getPhase();
    }

    public PhaseState currentState() {
        return state.get();
    }

    public ReadinessReport lastReport() {
        return lastReport.get();
    }

    public boolean isScheduled() {
        ScheduledFuture<?> current = evaluationTask.get();
        return current != null && !current.isCancelled();
    }
}
