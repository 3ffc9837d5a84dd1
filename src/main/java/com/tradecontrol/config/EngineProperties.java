package com.tradecontrol.config;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Timing and capacity settings for the control loop, heartbeat supervisor and execution gateway.
 *
 * <p>Properties prefix: {@code tradecontrol.engine.*}.
 *
 * <p>A loop is considered stalled when its last tick is older than
 * {@code loopPeriod * stallMultiplier}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradecontrol.engine")
public class EngineProperties {

    private Duration loopPeriod = Duration.ofSeconds(30);
    private Duration heartbeatPeriod = Duration.ofSeconds(10);
    private int stallMultiplier = 3;
    private int maxRestartAttempts = 3;
    private Duration gatewayTimeout = Duration.ofSeconds(15);
    private int signalInboxCapacity = 256;
    private int eventChannelCapacity = 1024;

    /** How long emergency shutdown waits for a symbol's lock before skipping it. */
    private Duration emergencyLockTimeout = Duration.ofSeconds(5);

    private boolean autoStart = false;

    /** Starting cash for the simulated account in paper mode. */
    private BigDecimal paperStartingBalance = new BigDecimal("10000");

    public Duration stallThreshold() {
        return loopPeriod.multipliedBy(stallMultiplier);
    }
}
