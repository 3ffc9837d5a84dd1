package com.tradecontrol.domain.enums;

public enum PositionSide {
    LONG,
    SHORT;

    /** Entry side that opens a position on this side. */
    public OrderSide entrySide() {
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    /** +1 for LONG, -1 for SHORT. Multiplier for realized P&L. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }

    public static PositionSide openedBy(OrderSide side) {
        return side == OrderSide.BUY ? LONG : SHORT;
    }
}
