package com.tradecontrol.persistence;

import com.tradecontrol.domain.model.Position;
import com.tradecontrol.domain.model.Trade;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for positions and trades. The engine depends on this interface only;
 * {@link JpaTradeStore} is the shipped implementation.
 *
 * <p>Saves are upserts keyed by id.
 */
public interface TradeStore {

    void savePosition(Position position);

    void saveTrade(Trade trade);

    Optional<Position> findPosition(String positionId);

    Optional<Trade> findTrade(String tradeId);

    /** Positions that are OPEN or CLOSING. */
    List<Position> findActivePositions();

    List<Trade> findPendingTrades();

    List<Trade> findTradesForPosition(String positionId);

    /** Most recently closed positions, newest first. */
    List<Position> findRecentClosedPositions(int limit);

    /** Number of CLOSED positions ever recorded. */
    long countClosedPositions();

    /** Sum of realized P&L of positions closed at or after {@code since}. */
    BigDecimal sumRealizedPnlSince(Instant since);
}
