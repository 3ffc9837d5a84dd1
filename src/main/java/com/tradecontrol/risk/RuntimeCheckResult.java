package com.tradecontrol.risk;

import java.math.BigDecimal;
import lombok.Getter;

@Getter
public class RuntimeCheckResult {

    private final boolean emergency;

    /** Fractional decline from peak equity; zero when there is no peak yet. */
    private final BigDecimal drawdown;

    public RuntimeCheckResult(boolean emergency, BigDecimal drawdown) {
        this.emergency = emergency;
        this.drawdown = drawdown;
    }
}
