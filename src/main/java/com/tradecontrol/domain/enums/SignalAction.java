package com.tradecontrol.domain.enums;

public enum SignalAction {
    BUY,
    SELL,
    CLOSE
}
