package com.tradecontrol.domain.enums;

/**
 * Engine lifecycle.
 *
 * <p>Valid transitions:
 * <pre>
 * STOPPED -> RUNNING -> STOPPED            (manual stop)
 *            RUNNING -> EMERGENCY_STOPPED  (drawdown breach or restart exhaustion)
 * EMERGENCY_STOPPED -> STOPPED             (explicit operator re-arm only)
 * </pre>
 */
public enum EngineState {
    STOPPED,
    RUNNING,
    EMERGENCY_STOPPED
}
