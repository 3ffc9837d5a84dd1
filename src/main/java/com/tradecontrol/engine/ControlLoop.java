package com.tradecontrol.engine;

import com.tradecontrol.account.AccountSnapshotProvider;
import com.tradecontrol.config.EngineProperties;
import com.tradecontrol.domain.enums.EngineState;
import com.tradecontrol.domain.enums.RejectionReason;
import com.tradecontrol.domain.model.AccountSnapshot;
import com.tradecontrol.domain.model.RiskProfile;
import com.tradecontrol.domain.model.Signal;
import com.tradecontrol.event.EventPublisherHelper;
import com.tradecontrol.event.RiskEventType;
import com.tradecontrol.exception.ConnectivityException;
import com.tradecontrol.exception.EngineStateException;
import com.tradecontrol.exception.RiskLimitExceededException;
import com.tradecontrol.ledger.EntrySizer;
import com.tradecontrol.ledger.PositionLedger;
import com.tradecontrol.ledger.SignalResult;
import com.tradecontrol.risk.EquityWatermark;
import com.tradecontrol.risk.PreFlightResult;
import com.tradecontrol.risk.RiskDecision;
import com.tradecontrol.risk.RiskGovernor;
import com.tradecontrol.risk.RiskProfileHolder;
import com.tradecontrol.risk.RuntimeCheckResult;
import com.tradecontrol.signal.SignalInbox;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Lazy;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * The periodic signal-processing loop. Each tick, in order:
 * <ol>
 *   <li>fetch the account snapshot (the provider retries with backoff); on failure mark DEGRADED</li>
 *   <li>update the equity watermark and run the drawdown check; a breach hands over to the
 *       emergency shutdown sequence and ends the tick</li>
 *   <li>reconcile unresolved submissions by status query</li>
 *   <li>resubmit exits that were rejected on an earlier tick</li>
 *   <li>drain the signal inbox and process signals in arrival order</li>
 * </ol>
 *
 * <p>Ticks never overlap. The loop is scheduled with a fixed delay, and a tick that finds
 * another still in flight (possible after a supervisor restart) returns immediately. A skipped
 * tick is not queued.
 *
 * <p>The completion time of every tick is recorded from the {@link MonotonicClock}; the
 * {@link HeartbeatSupervisor} compares it against the stall threshold.
 */
@Service
public class ControlLoop {

    private static final Logger log = LoggerFactory.getLogger(ControlLoop.class);

    private final EngineStateHolder engineStateHolder;
    private final SignalInbox signalInbox;
    private final PositionLedger positionLedger;
    private final RiskGovernor riskGovernor;
    private final RiskProfileHolder riskProfileHolder;
    private final EquityWatermark equityWatermark;
    private final AccountSnapshotProvider accountSnapshotProvider;
    private final TaskScheduler taskScheduler;
    private final EngineProperties engineProperties;
    private final MonotonicClock monotonicClock;
    private final EventPublisherHelper eventPublisherHelper;
    private final EmergencyTrigger emergencyTrigger;

    private final AtomicBoolean tickInFlight = new AtomicBoolean(false);
    private final AtomicLong lastTickNanos = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();
    private final AtomicReference<ScheduledFuture<?>> scheduledLoop = new AtomicReference<>();

    public ControlLoop(
            EngineStateHolder engineStateHolder,
            SignalInbox signalInbox,
            PositionLedger positionLedger,
            RiskGovernor riskGovernor,
            RiskProfileHolder riskProfileHolder,
            EquityWatermark equityWatermark,
            AccountSnapshotProvider accountSnapshotProvider,
            @Qualifier("engineScheduler") TaskScheduler taskScheduler,
            EngineProperties engineProperties,
            MonotonicClock monotonicClock,
            EventPublisherHelper eventPublisherHelper,
            @Lazy EmergencyTrigger emergencyTrigger) {
        this.engineStateHolder = engineStateHolder;
        this.signalInbox = signalInbox;
        this.positionLedger = positionLedger;
        this.riskGovernor = riskGovernor;
        this.riskProfileHolder = riskProfileHolder;
        this.equityWatermark = equityWatermark;
        this.accountSnapshotProvider = accountSnapshotProvider;
        this.taskScheduler = taskScheduler;
        this.engineProperties = engineProperties;
        this.monotonicClock = monotonicClock;
        this.eventPublisherHelper = eventPublisherHelper;
        this.emergencyTrigger = emergencyTrigger;
        this.lastTickNanos.set(monotonicClock.nanoTime());
    }

    // ========================
    // LIFECYCLE
    // ========================

    /**
     * Runs pre-flight, moves the engine to RUNNING and schedules the loop.
     *
     * @throws EngineStateException when the engine is emergency-stopped
     * @throws RiskLimitExceededException when pre-flight fails
     */
    public void start() {
        EngineState state = engineStateHolder.state();
        if (state == EngineState.EMERGENCY_STOPPED) {
            throw new EngineStateException("Engine is emergency-stopped; re-arm before starting", state);
        }
        if (state == EngineState.RUNNING) {
            log.info("Start requested but engine is already RUNNING");
            return;
        }

        AccountSnapshot account = fetchAccount();
        PreFlightResult preFlight = riskGovernor.preFlight(account, riskProfileHolder.current());
        if (!preFlight.isPassed()) {
            eventPublisherHelper.publishRisk(
                    this, RiskEventType.PRE_FLIGHT_FAILED, "Pre-flight failed", Map.of("failures", preFlight.getFailures()));
            throw new RiskLimitExceededException("Pre-flight checks failed", Map.of("failures", preFlight.getFailures()));
        }
        equityWatermark.observe(account.getEquity());

        engineStateHolder.markRunning("Pre-flight passed");
        lastTickNanos.set(monotonicClock.nanoTime());
        schedule();
        signalInbox.open();
        log.info("Control loop started (period={})", engineProperties.getLoopPeriod());
    }

    /** Stops accepting signals and cancels the timer. A tick in flight runs to completion. */
    public void stop(String reason) {
        signalInbox.close();
        cancel();
        engineStateHolder.markStopped(reason);
    }

    /** Replaces the scheduled loop with a fresh one. Engine state is unchanged. */
    public void restart() {
        log.warn("Restarting control loop (tick in flight: {})", tickInFlight.get());
        schedule();
    }

    /** Cancels the timer without touching engine state or interrupting a running tick. */
    public void cancel() {
        ScheduledFuture<?> current = scheduledLoop.getAndSet(null);
        if (current != null) {
            current.cancel(false);
        }
    }

    private void schedule() {
        ScheduledFuture<?> future = taskScheduler.scheduleWithFixedDelay(this::tick, engineProperties.getLoopPeriod());
        ScheduledFuture<?> previous = scheduledLoop.getAndSet(future);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    // ========================
    // SIGNAL INTAKE
    // ========================

    /**
     * Queues a validated signal for the next tick.
     *
     * @throws EngineStateException when the engine is not RUNNING or the inbox is full
     */
    public void accept(Signal signal) {
        EngineState state = engineStateHolder.state();
        if (state != EngineState.RUNNING) {
            throw new EngineStateException("Engine is not accepting signals", state);
        }
        if (!signalInbox.offer(signal)) {
            throw new EngineStateException("Signal inbox is full or closed", state);
        }
    }

    // ========================
    // TICK
    // ========================

    public void tick() {
        if (!tickInFlight.compareAndSet(false, true)) {
            long skipped = skippedTicks.incrementAndGet();
            log.debug("Tick skipped: previous tick still in flight ({} skipped so far)", skipped);
            return;
        }
        try {
            if (engineStateHolder.state() != EngineState.RUNNING) {
                return;
            }
            runTick();
        } catch (RuntimeException e) {
            log.error("Control loop tick failed: {}", e.getMessage(), e);
        } finally {
            lastTickNanos.set(monotonicClock.nanoTime());
            tickInFlight.set(false);
        }
    }

    private void runTick() {
        RiskProfile profile = riskProfileHolder.current();
        AccountSnapshot account = fetchAccount();

        if (account == null) {
            engineStateHolder.markDegraded("Account provider unreachable");
        } else {
            engineStateHolder.clearDegraded("Account provider reachable");
            BigDecimal peak = equityWatermark.observe(account.getEquity());
            RuntimeCheckResult runtime = riskGovernor.checkRuntime(account, peak, profile);
            if (runtime.isEmergency()) {
                String reason = "Drawdown " + runtime.getDrawdown().toPlainString() + " reached emergency stop loss "
                        + profile.getEmergencyStopLoss().toPlainString();
                eventPublisherHelper.publishRisk(
                        this,
                        RiskEventType.EMERGENCY_DRAWDOWN,
                        reason,
                        Map.of("peakEquity", peak, "equity", account.getEquity()));
                emergencyTrigger.emergencyShutdown(reason);
                return;
            }
        }

        positionLedger.reconcilePending();
        positionLedger.retryFailedCloses();

        List<Signal> batch = signalInbox.drain();
        for (Signal signal : batch) {
            if (engineStateHolder.state() != EngineState.RUNNING) {
                log.warn("Engine left RUNNING mid-tick; {} signals dropped", batch.size());
                return;
            }
            process(signal, account, profile);
        }
    }

    private void process(Signal signal, AccountSnapshot account, RiskProfile profile) {
        if (signal.getPrice() != null) {
            positionLedger.markPrice(signal.getSymbol(), signal.getPrice())
                    .ifPresent(exit -> log.info("Protective exit for {}: {}", signal.getSymbol(), exit));
        }
        EntrySizer sizer = candidate -> sizeEntry(candidate, account, profile);
        SignalResult result = positionLedger.processSignal(signal, sizer);
        log.debug("Signal {} {} -> {}", signal.getAction(), signal.getSymbol(), result);
    }

    private RiskDecision sizeEntry(Signal signal, AccountSnapshot account, RiskProfile profile) {
        EngineStatus status = engineStateHolder.current();
        if (!status.isRunning()) {
            return RiskDecision.rejected(RejectionReason.ENGINE_NOT_RUNNING, "Engine is " + status.getState());
        }
        if (account == null || status.isDegraded()) {
            return RiskDecision.rejected(RejectionReason.ENGINE_DEGRADED, "No fresh account snapshot");
        }
        return riskGovernor.evaluate(signal, account, profile, positionLedger.exposure());
    }

    /**
     * Returns null when the provider stays unreachable through its retries or its circuit
     * breaker is open.
     */
    AccountSnapshot fetchAccount() {
        try {
            return accountSnapshotProvider.fetch();
        } catch (ConnectivityException e) {
            log.warn("Account fetch failed: {}", e.getMessage());
            return null;
        } catch (CallNotPermittedException e) {
            log.warn("Account fetch short-circuited: {}", e.getMessage());
            return null;
        }
    }

    // ========================
    // OBSERVATION
    // ========================

    public long getLastTickNanos() {
        return lastTickNanos.get();
    }

    public boolean isTickInFlight() {
        return tickInFlight.get();
    }

    public boolean isScheduled() {
        ScheduledFuture<?> current = scheduledLoop.get();
        return current != null && !current.isCancelled();
    }

    public long getSkippedTicks() {
        return skippedTicks.get();
    }
}
