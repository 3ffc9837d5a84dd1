package com.tradecontrol.domain.enums;

/**
 * Lifecycle of a position. Transitions only move forward:
 * <pre>
 * OPEN -> CLOSING -> CLOSED
 * </pre>
 *
 * <p>CLOSING means an exit order has been accepted by the venue (or its outcome is
 * unknown) but no fill has been confirmed yet.
 */
public enum PositionStatus {
    OPEN,
    CLOSING,
    CLOSED;

    public boolean canTransitionTo(PositionStatus next) {
        return next.ordinal() == ordinal() + 1;
    }
}
