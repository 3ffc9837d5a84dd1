package com.tradecontrol.exception;

/**
 * The venue or the account provider could not be reached after the configured retries.
 */
public class ConnectivityException extends BaseException {

    public ConnectivityException(String message) {
        super(ErrorCode.VENUE_UNAVAILABLE, message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(ErrorCode.VENUE_UNAVAILABLE, message, cause);
    }
}
