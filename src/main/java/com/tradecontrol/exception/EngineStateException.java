package com.tradecontrol.exception;

import com.tradecontrol.domain.enums.EngineState;
import java.util.Map;

/**
 * An operator command is not valid for the engine's current state,
 * e.g. starting while EMERGENCY_STOPPED without a re-arm.
 */
public class EngineStateException extends BaseException {

    public EngineStateException(String message, EngineState current) {
        super(ErrorCode.INVALID_STATE, message, Map.of("state", current.name()));
    }
}
