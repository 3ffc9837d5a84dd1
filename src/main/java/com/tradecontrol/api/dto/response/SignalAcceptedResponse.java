package com.tradecontrol.api.dto.response;

import com.tradecontrol.domain.enums.SignalAction;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SignalAcceptedResponse {

    private final SignalAction action;
    private final String symbol;
    private final int queuedSignals;
}
