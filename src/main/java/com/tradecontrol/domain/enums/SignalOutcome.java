package com.tradecontrol.domain.enums;

public enum SignalOutcome {
    OPENED,
    CLOSED,
    /** Exit filled for part of the quantity. The remainder stays active. */
    PARTIALLY_CLOSED,
    /** Nothing to do for the current state of the symbol. Not an error. */
    SKIPPED,
    REJECTED,
    /** Order submitted but its outcome is not yet known. */
    PENDING
}
