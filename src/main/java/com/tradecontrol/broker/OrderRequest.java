package com.tradecontrol.broker;

import com.tradecontrol.domain.enums.OrderSide;
import com.tradecontrol.domain.enums.OrderType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Single input type for {@link ExecutionGateway#submit}.
 *
 * <p>The clientOrderId is generated once per accepted signal and never reused for a second
 * submission; it is the key used to reconcile an indeterminate outcome.
 */
@Data
@Builder
public class OrderRequest {

    private String clientOrderId;
    private String symbol;
    private OrderSide side;
    private BigDecimal quantity;

    @Builder.Default
    private OrderType orderType = OrderType.MARKET;

    /** Required for LIMIT orders. */
    private BigDecimal limitPrice;

    /** Last known price; used for paper fills and for the default fee estimate. */
    private BigDecimal referencePrice;

    private String strategyId;
}
