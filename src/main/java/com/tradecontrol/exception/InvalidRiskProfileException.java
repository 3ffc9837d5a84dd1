package com.tradecontrol.exception;

import java.util.Map;

public class InvalidRiskProfileException extends BaseException {

    public InvalidRiskProfileException(Map<String, Object> fieldErrors) {
        super(ErrorCode.VALIDATION_ERROR, "Invalid risk profile", fieldErrors);
    }
}
