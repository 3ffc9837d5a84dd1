package com.tradecontrol.domain.enums;

/** Execution status of a single trade record. */
public enum TradeStatus {
    /** Submitted, fill not yet confirmed (includes timed-out submissions awaiting reconciliation). */
    PENDING,
    FILLED,
    REJECTED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
