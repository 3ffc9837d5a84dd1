package com.tradecontrol.risk;

import com.tradecontrol.domain.enums.RejectionReason;
import java.math.BigDecimal;
import lombok.Getter;

/**
 * Outcome of {@link RiskGovernor#evaluate}: either a sized order (quantity and notional)
 * or a rejection with its reason.
 */
@Getter
public class RiskDecision {

    private final boolean approved;
    private final BigDecimal quantity;
    private final BigDecimal notional;
    private final RejectionReason reason;
    private final String message;

    private RiskDecision(
            boolean approved, BigDecimal quantity, BigDecimal notional, RejectionReason reason, String message) {
        this.approved = approved;
        this.quantity = quantity;
        this.notional = notional;
        this.reason = reason;
        this.message = message;
    }

    public static RiskDecision sized(BigDecimal quantity, BigDecimal notional) {
        return new RiskDecision(true, quantity, notional, null, null);
    }

    public static RiskDecision rejected(RejectionReason reason, String message) {
        return new RiskDecision(false, null, null, reason, message);
    }

    public boolean isRejected() {
        return !approved;
    }

    @Override
    public String toString() {
        return approved ? "SIZED " + quantity + " (" + notional + ")" : reason + ": " + message;
    }
}
