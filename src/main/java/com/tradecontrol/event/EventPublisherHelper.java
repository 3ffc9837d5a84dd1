package com.tradecontrol.event;

import com.tradecontrol.domain.enums.DegradationLevel;
import com.tradecontrol.domain.enums.EngineState;
import com.tradecontrol.domain.enums.PhaseAction;
import com.tradecontrol.domain.enums.RejectionReason;
import com.tradecontrol.domain.model.Position;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods for engine events. Everything goes through the
 * {@link EngineEventChannel}, never straight to the Spring publisher.
 */
@Component
public class EventPublisherHelper {

    private final EngineEventChannel channel;

    public EventPublisherHelper(EngineEventChannel channel) {
        this.channel = channel;
    }

    // ---- Position ----

    public void publishPositionOpened(Object source, Position position) {
        channel.publish(new PositionEvent(source, position.toBuilder().build(), PositionEventType.OPENED));
    }

    public void publishPositionClosed(Object source, Position position) {
        channel.publish(new PositionEvent(source, position.toBuilder().build(), PositionEventType.CLOSED));
    }

    public void publishCloseFailed(Object source, Position position) {
        channel.publish(new PositionEvent(source, position.toBuilder().build(), PositionEventType.CLOSE_FAILED));
    }

    // ---- Risk ----

    public void publishSignalRejected(Object source, String symbol, RejectionReason reason, String message) {
        channel.publish(new RiskEvent(source, RiskEventType.SIGNAL_REJECTED, reason, message, Map.of("symbol", symbol)));
    }

    public void publishRisk(Object source, RiskEventType type, String message, Map<String, Object> details) {
        channel.publish(new RiskEvent(source, type, null, message, details));
    }

    // ---- Engine ----

    public void publishEngineState(
            Object source, EngineState previous, EngineState current, DegradationLevel degradation, String reason) {
        channel.publish(new EngineStateEvent(source, previous, current, degradation, reason));
    }

    // ---- Phase ----

    public void publishPhase(Object source, int previousPhase, int newPhase, double readiness, PhaseAction action) {
        channel.publish(new PhaseEvent(source, previousPhase, newPhase, readiness, action));
    }
}
