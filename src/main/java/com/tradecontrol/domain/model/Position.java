package com.tradecontrol.domain.model;

import com.tradecontrol.domain.enums.PositionSide;
import com.tradecontrol.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A unit of open market exposure on one symbol.
 *
 * <p>Status moves forward only (OPEN -> CLOSING -> CLOSED). Trade binding is idempotent by
 * trade id: binding the same id again is a no-op, binding a different id throws. A CLOSED
 * position therefore always carries exactly one entry and one exit trade.
 *
 * <p>Mutated only by the position ledger while it holds the symbol's lock.
 */
@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String symbol;
    private PositionSide side;
    private BigDecimal quantity;
    private BigDecimal entryPrice;

    @Setter
    private BigDecimal currentPrice;

    @Setter
    private BigDecimal stopLoss;

    @Setter
    private BigDecimal takeProfit;

    private Instant openedAt;
    private PositionStatus status;
    private String strategyId;

    /** Venue order id of the entry order. */
    private String orderId;

    private String entryTradeId;
    private String exitTradeId;
    private BigDecimal exitPrice;
    private BigDecimal realizedPnl;
    private Instant closedAt;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public boolean isClosed() {
        return status == PositionStatus.CLOSED;
    }

    public BigDecimal notional() {
        return entryPrice.multiply(quantity);
    }

    public void bindEntryTrade(String tradeId) {
        entryTradeId = bind("entry", entryTradeId, tradeId);
    }

    public void bindExitTrade(String tradeId) {
        exitTradeId = bind("exit", exitTradeId, tradeId);
    }

    public void markClosing() {
        if (status == PositionStatus.CLOSING) {
            return;
        }
        transition(PositionStatus.CLOSING);
    }

    /**
     * Realizes P&L on the filled part of an exit that did not cover the whole quantity.
     * Status is unchanged and the remaining quantity stays exposed.
     *
     * @return P&L realized by this fill
     */
    public BigDecimal reduceBy(BigDecimal filled, BigDecimal fillPrice) {
        if (filled.signum() <= 0 || filled.compareTo(quantity) >= 0) {
            throw new IllegalArgumentException(
                    "Partial fill of " + filled + " is outside (0, " + quantity + ") for position " + id);
        }
        BigDecimal realized = fillPrice.subtract(entryPrice).multiply(filled).multiply(BigDecimal.valueOf(side.sign()));
        this.quantity = quantity.subtract(filled);
        this.realizedPnl = realizedPnl == null ? realized : realizedPnl.add(realized);
        this.currentPrice = fillPrice;
        return realized;
    }

    /**
     * Closes the position against a filled exit trade.
     * realizedPnl = (exitPrice - entryPrice) * quantity * sign(side), added to anything already
     * realized by earlier partial exits.
     */
    public void markClosed(String exitTrade, BigDecimal fillPrice, Instant at) {
        if (entryTradeId == null) {
            throw new IllegalStateException("Position " + id + " has no entry trade bound");
        }
        if (status == PositionStatus.OPEN) {
            transition(PositionStatus.CLOSING);
        }
        bindExitTrade(exitTrade);
        transition(PositionStatus.CLOSED);
        this.exitPrice = fillPrice;
        this.currentPrice = fillPrice;
        BigDecimal finalLeg = computePnl(fillPrice);
        this.realizedPnl = realizedPnl == null ? finalLeg : realizedPnl.add(finalLeg);
        this.closedAt = at;
    }

    public BigDecimal computePnl(BigDecimal price) {
        return price.subtract(entryPrice).multiply(quantity).multiply(BigDecimal.valueOf(side.sign()));
    }

    public BigDecimal unrealizedPnl() {
        return currentPrice == null ? BigDecimal.ZERO : computePnl(currentPrice);
    }

    private void transition(PositionStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal position transition " + status + " -> " + next + " for position " + id);
        }
        status = next;
    }

    private String bind(String kind, String current, String tradeId) {
        if (current == null || current.equals(tradeId)) {
            return tradeId;
        }
        throw new IllegalStateException(
                "Position " + id + " already has " + kind + " trade " + current + ", refusing " + tradeId);
    }
}
