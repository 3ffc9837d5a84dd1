package com.tradecontrol.ledger;

import com.tradecontrol.broker.OrderRequest;
import com.tradecontrol.domain.model.Trade;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/**
 * A submitted order whose outcome is not yet known. Resolved only by a status query,
 * never by resubmitting.
 */
@Getter
@Builder
public class PendingExecution {

    private final Trade trade;
    private final OrderRequest request;

    /** Protective levels to apply if an entry fills. */
    private final BigDecimal stopLoss;

    private final BigDecimal takeProfit;
    private final Instant registeredAt;

    public boolean isEntry() {
        return trade.isEntry();
    }

    public String getSymbol() {
        return trade.getSymbol();
    }
}
