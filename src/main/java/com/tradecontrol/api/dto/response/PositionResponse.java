package com.tradecontrol.api.dto.response;

import com.tradecontrol.domain.enums.PositionSide;
import com.tradecontrol.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionResponse {

    private String id;
    private String symbol;
    private PositionSide side;
    private PositionStatus status;
    private BigDecimal quantity;
    private BigDecimal entryPrice;
    private BigDecimal currentPrice;
    private BigDecimal stopLoss;
    private BigDecimal takeProfit;
    private BigDecimal unrealizedPnl;
    private String strategyId;
    private String orderId;
    private Instant openedAt;
}
