package com.tradecontrol.risk;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/** Highest equity observed since the last reset. Drawdown is measured against it. */
@Component
public class EquityWatermark {

    private final AtomicReference<BigDecimal> peak = new AtomicReference<>();

    /** Records an equity observation and returns the peak after it. */
    public BigDecimal observe(BigDecimal equity) {
        return peak.accumulateAndGet(equity, (current, next) -> current == null || next.compareTo(current) > 0
                ? next
                : current);
    }

    /** Null until the first observation. */
    public BigDecimal getPeak() {
        return peak.get();
    }

    /** Forgets the peak; the next observation starts a new one. Used on re-arm. */
    public void reset() {
        peak.set(null);
    }
}
