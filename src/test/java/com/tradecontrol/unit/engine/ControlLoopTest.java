package com.tradecontrol.unit.engine;

import static com.tradecontrol.support.TestFixtures.NOW;
import static com.tradecontrol.support.TestFixtures.account;
import static com.tradecontrol.support.TestFixtures.buy;
import static com.tradecontrol.support.TestFixtures.defaultProfile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tradecontrol.account.AccountSnapshotProvider;
import com.tradecontrol.config.EngineProperties;
import com.tradecontrol.domain.enums.EngineState;
import com.tradecontrol.domain.enums.RejectionReason;
import com.tradecontrol.domain.model.ExposureSnapshot;
import com.tradecontrol.domain.model.Signal;
import com.tradecontrol.engine.ControlLoop;
import com.tradecontrol.engine.EmergencyTrigger;
import com.tradecontrol.engine.EngineStateHolder;
import com.tradecontrol.event.EventPublisherHelper;
import com.tradecontrol.event.RiskEventType;
import com.tradecontrol.exception.ConnectivityException;
import com.tradecontrol.exception.EngineStateException;
import com.tradecontrol.exception.RiskLimitExceededException;
import com.tradecontrol.ledger.EntrySizer;
import com.tradecontrol.ledger.PositionLedger;
import com.tradecontrol.risk.EquityWatermark;
import com.tradecontrol.risk.RiskDecision;
import com.tradecontrol.risk.RiskGovernor;
import com.tradecontrol.risk.RiskProfileHolder;
import com.tradecontrol.signal.SignalInbox;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

/**
 * Unit tests for ControlLoop: start gating, tick ordering, degradation, drawdown hand-off
 * and the no-overlap guard.
 */
@ExtendWith(MockitoExtension.class)
class ControlLoopTest {

    @Mock
    private PositionLedger positionLedger;

    @Mock
    private AccountSnapshotProvider accountSnapshotProvider;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private EmergencyTrigger emergencyTrigger;

    private final AtomicLong nanos = new AtomicLong(1_000L);

    private EngineStateHolder engineStateHolder;
    private SignalInbox signalInbox;
    private EquityWatermark equityWatermark;
    private ControlLoop controlLoop;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.setLoopPeriod(Duration.ofSeconds(1));

        engineStateHolder = new EngineStateHolder(eventPublisherHelper, Clock.fixed(NOW, ZoneOffset.UTC));
        signalInbox = new SignalInbox(properties);
        equityWatermark = new EquityWatermark();
        controlLoop = new ControlLoop(
                engineStateHolder,
                signalInbox,
                positionLedger,
                new RiskGovernor(),
                new RiskProfileHolder(defaultProfile()),
                equityWatermark,
                accountSnapshotProvider,
                taskScheduler,
                properties,
                nanos::get,
                eventPublisherHelper,
                emergencyTrigger);
    }

    private void startHealthy() {
        when(accountSnapshotProvider.fetch()).thenReturn(account("20000", "20000"));
        controlLoop.start();
    }

    // ==============================
    // START
    // ==============================

    @Nested
    @DisplayName("Start")
    class Start {

        @Test
        @DisplayName("Passing pre-flight moves to RUNNING, schedules the loop and opens the inbox")
        void startsRunning() {
            startHealthy();

            assertThat(engineStateHolder.state()).isEqualTo(EngineState.RUNNING);
            assertThat(signalInbox.isAccepting()).isTrue();
            assertThat(equityWatermark.getPeak()).isEqualByComparingTo("20000");
            verify(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofSeconds(1)));
        }

        @Test
        @DisplayName("Unreachable account fails pre-flight with a single provider call and stays STOPPED")
        void unreachableAccount() {
            when(accountSnapshotProvider.fetch()).thenThrow(new ConnectivityException("timeout"));

            assertThatThrownBy(() -> controlLoop.start())
                    .isInstanceOf(RiskLimitExceededException.class)
                    .hasMessage("Pre-flight checks failed");

            assertThat(engineStateHolder.state()).isEqualTo(EngineState.STOPPED);
            verify(accountSnapshotProvider, times(1)).fetch();
            verify(eventPublisherHelper).publishRisk(any(), eq(RiskEventType.PRE_FLIGHT_FAILED), anyString(), any());
            verifyNoInteractions(taskScheduler);
        }

        @Test
        @DisplayName("Start while emergency-stopped is refused")
        void startAfterEmergency() {
            engineStateHolder.enterEmergency("drawdown");

            assertThatThrownBy(() -> controlLoop.start())
                    .isInstanceOf(EngineStateException.class)
                    .hasMessageContaining("re-arm");
            verifyNoInteractions(accountSnapshotProvider);
        }

        @Test
        @DisplayName("Stop closes the inbox, cancels the timer and returns to STOPPED")
        void stop() {
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            doReturn(future).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
            startHealthy();

            controlLoop.stop("operator");

            assertThat(engineStateHolder.state()).isEqualTo(EngineState.STOPPED);
            assertThat(signalInbox.isAccepting()).isFalse();
            verify(future).cancel(false);
            assertThat(controlLoop.isScheduled()).isFalse();
        }
    }

    // ==============================
    // SIGNAL INTAKE
    // ==============================

    @Nested
    @DisplayName("Signal intake")
    class Intake {

        @Test
        @DisplayName("Signals are refused unless RUNNING")
        void refusedWhenStopped() {
            assertThatThrownBy(() -> controlLoop.accept(buy("BTCUSD", "100")))
                    .isInstanceOf(EngineStateException.class)
                    .hasMessage("Engine is not accepting signals");
        }
    }

    // ==============================
    // TICK
    // ==============================

    @Nested
    @DisplayName("Tick")
    class Tick {

        @Test
        @DisplayName("Reconciles, retries failed closes, then processes signals in arrival order")
        void tickOrdering() {
            startHealthy();
            Signal first = buy("BTCUSD", "100");
            Signal second = buy("ETHUSD", "50");
            controlLoop.accept(first);
            controlLoop.accept(second);

            controlLoop.tick();

            InOrder order = inOrder(positionLedger);
            order.verify(positionLedger).reconcilePending();
            order.verify(positionLedger).retryFailedCloses();
            order.verify(positionLedger).processSignal(eq(first), any(EntrySizer.class));
            order.verify(positionLedger).processSignal(eq(second), any(EntrySizer.class));
            assertThat(signalInbox.size()).isZero();
        }

        @Test
        @DisplayName("Entry sizer passes current exposure to the risk governor")
        void sizerUsesGovernor() {
            startHealthy();
            when(positionLedger.exposure()).thenReturn(ExposureSnapshot.empty());
            Signal signal = buy("BTCUSD", "100");
            controlLoop.accept(signal);

            controlLoop.tick();

            ArgumentCaptor<EntrySizer> sizer = ArgumentCaptor.forClass(EntrySizer.class);
            verify(positionLedger).processSignal(eq(signal), sizer.capture());
            RiskDecision decision = sizer.getValue().size(signal);
            assertThat(decision.isApproved()).isTrue();
            assertThat(decision.getNotional()).isEqualByComparingTo("200");
        }

        @Test
        @DisplayName("Unreachable account marks DEGRADED and blocks new entries")
        void degraded() {
            when(accountSnapshotProvider.fetch())
                    .thenReturn(account("20000", "20000"))
                    .thenThrow(new ConnectivityException("timeout"));
            controlLoop.start();
            Signal signal = buy("BTCUSD", "100");
            controlLoop.accept(signal);

            controlLoop.tick();

            assertThat(engineStateHolder.current().isDegraded()).isTrue();
            ArgumentCaptor<EntrySizer> sizer = ArgumentCaptor.forClass(EntrySizer.class);
            verify(positionLedger).processSignal(eq(signal), sizer.capture());
            assertThat(sizer.getValue().size(signal).getReason()).isEqualTo(RejectionReason.ENGINE_DEGRADED);
        }

        @Test
        @DisplayName("Open account circuit breaker marks DEGRADED like a connectivity failure")
        void openCircuitDegrades() {
            CircuitBreaker breaker = CircuitBreaker.ofDefaults("accountSnapshot");
            breaker.transitionToOpenState();
            when(accountSnapshotProvider.fetch())
                    .thenReturn(account("20000", "20000"))
                    .thenThrow(CallNotPermittedException.createCallNotPermittedException(breaker));
            controlLoop.start();

            controlLoop.tick();

            assertThat(engineStateHolder.current().isDegraded()).isTrue();
            assertThat(engineStateHolder.current().getReason()).isEqualTo("Account provider unreachable");
        }

        @Test
        @DisplayName("Drawdown breach hands over to emergency shutdown and ends the tick")
        void drawdownBreach() {
            when(accountSnapshotProvider.fetch())
                    .thenReturn(account("20000", "20000"))
                    .thenReturn(account("15000", "15000"));
            controlLoop.start();
            controlLoop.accept(buy("BTCUSD", "100"));

            controlLoop.tick();

            verify(emergencyTrigger).emergencyShutdown(contains("Drawdown"));
            verify(eventPublisherHelper).publishRisk(any(), eq(RiskEventType.EMERGENCY_DRAWDOWN), anyString(), any());
            verify(positionLedger, never()).reconcilePending();
            verify(positionLedger, never()).processSignal(any(), any());
        }

        @Test
        @DisplayName("Tick does nothing while STOPPED but still records completion time")
        void idleWhenStopped() {
            nanos.set(42L);

            controlLoop.tick();

            verifyNoInteractions(accountSnapshotProvider, positionLedger);
            assertThat(controlLoop.getLastTickNanos()).isEqualTo(42L);
        }

        @Test
        @DisplayName("A tick that finds another in flight is skipped, not queued")
        void overlappingTickSkipped() {
            AtomicReference<Boolean> reentered = new AtomicReference<>(false);
            when(accountSnapshotProvider.fetch()).thenAnswer(invocation -> {
                if (engineStateHolder.state() == EngineState.RUNNING && !reentered.get()) {
                    reentered.set(true);
                    controlLoop.tick();
                }
                return account("20000", "20000");
            });
            controlLoop.start();

            controlLoop.tick();

            assertThat(controlLoop.getSkippedTicks()).isEqualTo(1);
            assertThat(controlLoop.isTickInFlight()).isFalse();
            verify(positionLedger).reconcilePending();
        }
    }
}
