package com.tradecontrol.engine;

import com.tradecontrol.config.EngineProperties;
import com.tradecontrol.domain.enums.EngineState;
import com.tradecontrol.ledger.EmergencyCloseReport;
import com.tradecontrol.ledger.PositionLedger;
import com.tradecontrol.risk.EquityWatermark;
import com.tradecontrol.signal.SignalInbox;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Watches the control loop's liveness on its own timer and owns the emergency shutdown sequence.
 *
 * <p>Every heartbeat period the supervisor compares the loop's last-tick timestamp with the
 * monotonic clock. When the gap exceeds {@code loopPeriod * stallMultiplier} it restarts the
 * loop, up to {@code maxRestartAttempts} times. A fresh tick resets the attempt counter. Once
 * the attempts are used up it runs {@link #emergencyShutdown}.
 *
 * <p>Emergency shutdown, in order:
 * <ol>
 *   <li>close the signal inbox and discard queued signals</li>
 *   <li>cancel the loop timer</li>
 *   <li>enter EMERGENCY_STOPPED, so no tick still in flight can open exposure</li>
 *   <li>submit exactly one exit per OPEN position, logging the ones that fail</li>
 * </ol>
 * Leaving EMERGENCY_STOPPED requires {@link #rearm}; nothing here does it automatically.
 */
@Service
public class HeartbeatSupervisor implements EmergencyTrigger {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatSupervisor.class);

    private final EngineStateHolder engineStateHolder;
    private final ControlLoop controlLoop;
    private final PositionLedger positionLedger;
    private final SignalInbox signalInbox;
    private final EquityWatermark equityWatermark;
    private final EngineProperties engineProperties;
    private final MonotonicClock monotonicClock;
    private final TaskScheduler taskScheduler;

    private final AtomicInteger restartAttempts = new AtomicInteger();
    private final AtomicLong lastObservedTick = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong lastPulseNanos = new AtomicLong();
    private final AtomicBoolean emergencyLatched = new AtomicBoolean(false);
    private final AtomicReference<EmergencyCloseReport> lastEmergencyReport = new AtomicReference<>();
    private final AtomicReference<ScheduledFuture<?>> pulseTask = new AtomicReference<>();

    public HeartbeatSupervisor(
            EngineStateHolder engineStateHolder,
            ControlLoop controlLoop,
            PositionLedger positionLedger,
            SignalInbox signalInbox,
            EquityWatermark equityWatermark,
            EngineProperties engineProperties,
            MonotonicClock monotonicClock,
            @Qualifier("engineScheduler") TaskScheduler taskScheduler) {
        this.engineStateHolder = engineStateHolder;
        this.controlLoop = controlLoop;
        this.positionLedger = positionLedger;
        this.signalInbox = signalInbox;
        this.equityWatermark = equityWatermark;
        this.engineProperties = engineProperties;
        this.monotonicClock = monotonicClock;
        this.taskScheduler = taskScheduler;
    }

    // ========================
    // PULSE
    // ========================

    public void startPulse() {
        ScheduledFuture<?> future =
                taskScheduler.scheduleAtFixedRate(this::pulse, engineProperties.getHeartbeatPeriod());
        ScheduledFuture<?> previous = pulseTask.getAndSet(future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.info("Heartbeat supervisor pulsing every {}", engineProperties.getHeartbeatPeriod());
    }

    public void stopPulse() {
        ScheduledFuture<?> current = pulseTask.getAndSet(null);
        if (current != null) {
            current.cancel(false);
        }
    }

    /** One liveness check. Public so tests can drive it with a manual clock. */
    public void pulse() {
        long now = monotonicClock.nanoTime();
        lastPulseNanos.set(now);
        try {
            if (engineStateHolder.state() != EngineState.RUNNING) {
                restartAttempts.set(0);
                return;
            }

            long lastTick = controlLoop.getLastTickNanos();
            if (lastObservedTick.getAndSet(lastTick) != lastTick && restartAttempts.get() > 0) {
                log.info("Control loop ticked again after {} restart attempt(s)", restartAttempts.get());
                restartAttempts.set(0);
            }

            long ageNanos = now - lastTick;
            long thresholdNanos = engineProperties.stallThreshold().toNanos();
            if (ageNanos <= thresholdNanos) {
                return;
            }

            int attempt = restartAttempts.incrementAndGet();
            int maxAttempts = engineProperties.getMaxRestartAttempts();
            if (attempt > maxAttempts) {
                emergencyShutdown("Control loop stalled for " + TimeUnit.NANOSECONDS.toMillis(ageNanos)
                        + "ms; " + maxAttempts + " restart attempts exhausted");
                return;
            }
            log.warn(
                    "Control loop stalled ({}ms since last tick, threshold {}ms); restart attempt {}/{}",
                    TimeUnit.NANOSECONDS.toMillis(ageNanos),
                    TimeUnit.NANOSECONDS.toMillis(thresholdNanos),
                    attempt,
                    maxAttempts);
            controlLoop.restart();
        } catch (RuntimeException e) {
            log.error("Heartbeat pulse failed: {}", e.getMessage(), e);
        }
    }

    // ========================
    // EMERGENCY
    // ========================

    @Override
    public void emergencyShutdown(String reason) {
        if (emergencyLatched.getAndSet(true)) {
            log.warn("Emergency shutdown already executed, ignoring: {}", reason);
            return;
        }
        log.error("EMERGENCY SHUTDOWN: {}", reason);

        signalInbox.close();
        signalInbox.clear();
        controlLoop.cancel();
        engineStateHolder.enterEmergency(reason);

        EmergencyCloseReport report = positionLedger.closeAllOpenForEmergency();
        lastEmergencyReport.set(report);
        if (!report.getFailed().isEmpty()) {
            log.error("Emergency shutdown left positions open for: {}", report.getFailed());
        }
    }

    /** Clears the emergency latch and returns the engine to STOPPED. */
    public void rearm(String reason) {
        engineStateHolder.rearm(reason);
        positionLedger.resumeEntries();
        emergencyLatched.set(false);
        restartAttempts.set(0);
        equityWatermark.reset();
    }

    // ========================
    // OBSERVATION
    // ========================

    public int getRestartAttempts() {
        return restartAttempts.get();
    }

    public long getLastPulseNanos() {
        return lastPulseNanos.get();
    }

    /** Null until the first emergency shutdown. */
    public EmergencyCloseReport getLastEmergencyReport() {
        return lastEmergencyReport.get();
    }
}
