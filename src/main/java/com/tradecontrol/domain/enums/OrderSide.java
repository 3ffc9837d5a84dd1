package com.tradecontrol.domain.enums;

/** Buy or sell side of an order or trade. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used for exit orders. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
