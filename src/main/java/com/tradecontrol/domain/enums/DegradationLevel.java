package com.tradecontrol.domain.enums;

/**
 * Overlay on RUNNING. DEGRADED keeps the loop alive but blocks new entries
 * until the account provider or venue answers again.
 */
public enum DegradationLevel {
    NONE,
    DEGRADED
}
