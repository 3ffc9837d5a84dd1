package com.tradecontrol.domain.model;

import com.tradecontrol.domain.enums.OrderSide;
import com.tradecontrol.domain.enums.TradeStatus;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single executed or attempted buy/sell.
 *
 * <p>positionId is null only for an entry trade whose position has not been created yet.
 * A REJECTED trade never creates or mutates a position.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Trade {

    private String id;
    private String symbol;
    private OrderSide side;
    private BigDecimal quantity;
    private BigDecimal price;
    private BigDecimal fees;
    private Instant executedAt;
    private String positionId;
    private boolean entry;
    private TradeStatus status;

    /** Venue-assigned order id, null until the venue acknowledged the order. */
    private String orderId;

    /** Client-side id sent with the order; the key for status reconciliation. */
    private String clientOrderId;

    private String strategyId;

    /** Set on exit trades once the position closes. */
    private BigDecimal realizedPnl;
}
