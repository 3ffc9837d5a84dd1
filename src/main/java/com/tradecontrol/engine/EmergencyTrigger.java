package com.tradecontrol.engine;

/** Entry point for the emergency shutdown sequence. Implemented by {@link HeartbeatSupervisor}. */
@FunctionalInterface
public interface EmergencyTrigger {

    void emergencyShutdown(String reason);
}
