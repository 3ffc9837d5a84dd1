package com.tradecontrol.domain.enums;

/** Normalized venue outcome for a submitted order. */
public enum ExecutionStatus {
    FILLED,
    /** Accepted by the venue, not yet filled. */
    PENDING,
    REJECTED,
    CANCELLED,
    /** Timed out or lost in transit; must be reconciled by a status query. */
    INDETERMINATE;

    public boolean isUnresolved() {
        return this == PENDING || this == INDETERMINATE;
    }

    public boolean isDead() {
        return this == REJECTED || this == CANCELLED;
    }
}
