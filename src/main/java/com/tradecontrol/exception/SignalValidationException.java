package com.tradecontrol.exception;

import java.util.Map;

/**
 * Raised at the ingestion boundary when an inbound signal payload is malformed or ambiguous.
 * The details map carries one entry per offending field.
 */
public class SignalValidationException extends BaseException {

    public SignalValidationException(String message, Map<String, Object> fieldErrors) {
        super(ErrorCode.VALIDATION_ERROR, message, fieldErrors);
    }
}
