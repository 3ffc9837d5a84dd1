package com.tradecontrol.persistence.entity;

import com.tradecontrol.domain.enums.PositionSide;
import com.tradecontrol.domain.enums.PositionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the positions table. */
@Entity
@Table(name = "positions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 50, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private PositionSide side;

    @Column(precision = 24, scale = 8)
    private BigDecimal quantity;

    @Column(name = "entry_price", precision = 24, scale = 8)
    private BigDecimal entryPrice;

    @Column(name = "current_price", precision = 24, scale = 8)
    private BigDecimal currentPrice;

    @Column(name = "stop_loss", precision = 24, scale = 8)
    private BigDecimal stopLoss;

    @Column(name = "take_profit", precision = 24, scale = 8)
    private BigDecimal takeProfit;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private PositionStatus status;

    @Column(name = "strategy_id", length = 100)
    private String strategyId;

    @Column(name = "order_id", length = 100)
    private String orderId;

    @Column(name = "entry_trade_id", length = 36)
    private String entryTradeId;

    @Column(name = "exit_trade_id", length = 36)
    private String exitTradeId;

    @Column(name = "exit_price", precision = 24, scale = 8)
    private BigDecimal exitPrice;

    @Column(name = "realized_pnl", precision = 24, scale = 8)
    private BigDecimal realizedPnl;

    @Column(name = "opened_at", nullable = false)
    private Instant openedAt;

    @Column(name = "closed_at")
    private Instant closedAt;
}
