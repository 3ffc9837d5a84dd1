package com.tradecontrol.persistence.entity;

import com.tradecontrol.domain.enums.OrderSide;
import com.tradecontrol.domain.enums.TradeStatus;
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

/**
 * JPA entity for the trades table. Holds entry and exit trades; exit trades carry the
 * realized P&L of the position they closed.
 */
@Entity
@Table(name = "trades")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 50, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private OrderSide side;

    @Column(precision = 24, scale = 8)
    private BigDecimal quantity;

    @Column(precision = 24, scale = 8)
    private BigDecimal price;

    @Column(precision = 24, scale = 8)
    private BigDecimal fees;

    @Column(name = "executed_at", nullable = false)
    private Instant executedAt;

    @Column(name = "position_id", length = 36)
    private String positionId;

    @Column(name = "is_entry", nullable = false)
    private boolean entry;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(12)")
    private TradeStatus status;

    @Column(name = "order_id", length = 100)
    private String orderId;

    @Column(name = "client_order_id", length = 36, nullable = false)
    private String clientOrderId;

    @Column(name = "strategy_id", length = 100)
    private String strategyId;

    @Column(name = "realized_pnl", precision = 24, scale = 8)
    private BigDecimal realizedPnl;
}
