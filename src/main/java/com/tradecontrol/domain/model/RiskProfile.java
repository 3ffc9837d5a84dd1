package com.tradecontrol.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Risk limits applied to every evaluation. Immutable; operator updates replace the whole
 * profile through {@link com.tradecontrol.risk.RiskProfileHolder}.
 */
@Value
@Builder(toBuilder = true)
public class RiskProfile {

    /** Fraction of equity committed per trade, e.g. 0.01. */
    BigDecimal riskFractionPerTrade;

    /** Absolute realized loss allowed before new entries stop. */
    BigDecimal maxDailyLoss;

    /** Cap on total open notional as a fraction of equity. */
    BigDecimal maxTotalRisk;

    /** Drawdown from peak equity, as a fraction, that triggers emergency shutdown. */
    BigDecimal emergencyStopLoss;

    int maxPositions;
    BigDecimal minTradeAmount;
    BigDecimal maxTradeAmount;

    /** Available balance floor checked before the loop starts. */
    BigDecimal minAccountBalance;
}
