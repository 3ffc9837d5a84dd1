package com.tradecontrol.ledger;

import com.tradecontrol.domain.enums.RejectionReason;
import com.tradecontrol.domain.enums.SignalOutcome;
import lombok.Getter;

/** What the ledger did with one signal. */
@Getter
public class SignalResult {

    private final SignalOutcome outcome;
    private final String symbol;
    private final String positionId;
    private final String tradeId;
    private final RejectionReason reason;
    private final String detail;

    private SignalResult(
            SignalOutcome outcome,
            String symbol,
            String positionId,
            String tradeId,
            RejectionReason reason,
            String detail) {
        this.outcome = outcome;
        this.symbol = symbol;
        this.positionId = positionId;
        this.tradeId = tradeId;
        this.reason = reason;
        this.detail = detail;
    }

    public static SignalResult opened(String symbol, String positionId, String tradeId) {
        return new SignalResult(SignalOutcome.OPENED, symbol, positionId, tradeId, null, null);
    }

    public static SignalResult closed(String symbol, String positionId, String tradeId) {
        return new SignalResult(SignalOutcome.CLOSED, symbol, positionId, tradeId, null, null);
    }

    public static SignalResult partiallyClosed(String symbol, String positionId, String tradeId, String detail) {
        return new SignalResult(SignalOutcome.PARTIALLY_CLOSED, symbol, positionId, tradeId, null, detail);
    }

    public static SignalResult skipped(String symbol, String detail) {
        return new SignalResult(SignalOutcome.SKIPPED, symbol, null, null, null, detail);
    }

    public static SignalResult rejected(String symbol, RejectionReason reason, String detail) {
        return new SignalResult(SignalOutcome.REJECTED, symbol, null, null, reason, detail);
    }

    public static SignalResult pending(String symbol, String positionId, String tradeId) {
        return new SignalResult(SignalOutcome.PENDING, symbol, positionId, tradeId, null, null);
    }

    @Override
    public String toString() {
        return outcome + " " + symbol + (reason != null ? " (" + reason + ")" : "")
                + (detail != null ? ": " + detail : "");
    }
}
