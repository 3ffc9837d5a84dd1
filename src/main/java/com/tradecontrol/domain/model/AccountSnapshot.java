package com.tradecontrol.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Point-in-time account view. Fetched fresh every tick, never cached across ticks. */
@Value
@Builder
public class AccountSnapshot {

    BigDecimal equity;
    BigDecimal availableBalance;
    BigDecimal realizedPnlToDate;
    Instant capturedAt;
}
