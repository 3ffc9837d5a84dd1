package com.tradecontrol.exception;

import java.util.Map;

public class RiskLimitExceededException extends BaseException {

    public RiskLimitExceededException(String message, Map<String, Object> details) {
        super(ErrorCode.RISK_LIMIT_EXCEEDED, message, details);
    }
}
