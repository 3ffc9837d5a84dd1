package com.tradecontrol.event;

/** Classifies the risk condition behind a {@link RiskEvent}. */
public enum RiskEventType {

    /** A signal was rejected or sized to zero. Not fatal. */
    SIGNAL_REJECTED,

    /** Realized loss-to-date has passed the configured daily limit. */
    DAILY_LOSS_LIMIT_BREACH,

    /** Drawdown from peak equity crossed the emergency threshold. */
    EMERGENCY_DRAWDOWN,

    /** Pre-flight refused to start the engine. */
    PRE_FLIGHT_FAILED
}
