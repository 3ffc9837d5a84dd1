package com.tradecontrol.persistence;

import com.tradecontrol.domain.enums.PositionStatus;
import com.tradecontrol.domain.enums.TradeStatus;
import com.tradecontrol.domain.model.Position;
import com.tradecontrol.domain.model.Trade;
import com.tradecontrol.persistence.mapper.PositionMapper;
import com.tradecontrol.persistence.mapper.TradeMapper;
import com.tradecontrol.persistence.repository.PositionJpaRepository;
import com.tradecontrol.persistence.repository.TradeJpaRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** {@link TradeStore} over Spring Data JPA. */
@Component
public class JpaTradeStore implements TradeStore {

    private static final PositionMapper POSITION_MAPPER = Mappers.getMapper(PositionMapper.class);
    private static final TradeMapper TRADE_MAPPER = Mappers.getMapper(TradeMapper.class);

    private final PositionJpaRepository positionJpaRepository;
    private final TradeJpaRepository tradeJpaRepository;

    public JpaTradeStore(PositionJpaRepository positionJpaRepository, TradeJpaRepository tradeJpaRepository) {
        this.positionJpaRepository = positionJpaRepository;
        this.tradeJpaRepository = tradeJpaRepository;
    }

    @Override
    @Transactional
    public void savePosition(Position position) {
        positionJpaRepository.save(POSITION_MAPPER.toEntity(position));
    }

    @Override
    @Transactional
    public void saveTrade(Trade trade) {
        tradeJpaRepository.save(TRADE_MAPPER.toEntity(trade));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Position> findPosition(String positionId) {
        return positionJpaRepository.findById(positionId).map(POSITION_MAPPER::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Trade> findTrade(String tradeId) {
        return tradeJpaRepository.findById(tradeId).map(TRADE_MAPPER::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Position> findActivePositions() {
        return POSITION_MAPPER.toDomainList(
                positionJpaRepository.findByStatusIn(EnumSet.of(PositionStatus.OPEN, PositionStatus.CLOSING)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Trade> findPendingTrades() {
        return TRADE_MAPPER.toDomainList(tradeJpaRepository.findByStatus(TradeStatus.PENDING));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Trade> findTradesForPosition(String positionId) {
        return TRADE_MAPPER.toDomainList(tradeJpaRepository.findByPositionIdOrderByExecutedAtAsc(positionId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Position> findRecentClosedPositions(int limit) {
        return POSITION_MAPPER.toDomainList(positionJpaRepository.findByStatusOrderByClosedAtDesc(
                PositionStatus.CLOSED, PageRequest.of(0, Math.max(1, limit))));
    }

    @Override
    @Transactional(readOnly = true)
    public long countClosedPositions() {
        return positionJpaRepository.countByStatus(PositionStatus.CLOSED);
    }

    @Override
    @Transactional(readOnly = true)
    public BigDecimal sumRealizedPnlSince(Instant since) {
        return positionJpaRepository.sumRealizedPnlSince(PositionStatus.CLOSED, since);
    }
}
