package com.tradecontrol.event;

import com.tradecontrol.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the position ledger after a position changes. Carries a copy of the
 * position taken at publish time, so listeners never observe later mutations.
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final PositionEventType eventType;

    public PositionEvent(Object source, Position position, PositionEventType eventType) {
        super(source);
        this.position = position;
        this.eventType = eventType;
    }

    public Position getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }
}
