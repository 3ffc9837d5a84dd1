package com.tradecontrol.domain.enums;

public enum OrderType {
    MARKET,
    LIMIT
}
