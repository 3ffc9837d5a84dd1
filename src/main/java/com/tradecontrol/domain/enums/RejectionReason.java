package com.tradecontrol.domain.enums;

public enum RejectionReason {
    TOO_SMALL,
    MAX_POSITIONS,
    DAILY_LOSS_LIMIT,
    TOTAL_RISK_EXCEEDED,
    DRAWDOWN_EMERGENCY,
    ENGINE_DEGRADED,
    ENGINE_NOT_RUNNING,
    MISSING_PRICE,
    VENUE_REJECTED
}
