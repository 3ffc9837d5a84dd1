package com.tradecontrol.domain.model;

import com.tradecontrol.domain.enums.OrderSide;
import com.tradecontrol.domain.enums.SignalAction;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A validated, already-scored directional signal. Instances are only built by
 * {@link com.tradecontrol.signal.SignalValidator} or by tests.
 */
@Value
@Builder
public class Signal {

    SignalAction action;
    String symbol;

    /** Fraction of available balance the scorer suggests committing, in (0, 1]. */
    BigDecimal sizeHint;

    /** Scorer confidence in [0, 1]. Informational for this core. */
    BigDecimal confidence;

    Instant timestamp;

    /** Reference price. Required for BUY and SELL. */
    BigDecimal price;

    /** Explicit quantity; when null the quantity is derived from the sized notional. */
    BigDecimal quantity;

    BigDecimal stopLoss;
    BigDecimal takeProfit;
    String strategyId;

    /** Order side implied by the action, or null for CLOSE. */
    public OrderSide orderSide() {
        switch (action) {
            case BUY:
                return OrderSide.BUY;
            case SELL:
                return OrderSide.SELL;
            default:
                return null;
        }
    }
}
