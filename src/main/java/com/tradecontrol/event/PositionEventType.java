package com.tradecontrol.event;

public enum PositionEventType {
    OPENED,
    CLOSED,
    /** An exit order was rejected or cancelled; the position stays OPEN or CLOSING. */
    CLOSE_FAILED
}
