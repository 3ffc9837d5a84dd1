package com.tradecontrol.persistence.repository;

import com.tradecontrol.domain.enums.TradeStatus;
import com.tradecontrol.persistence.entity.TradeEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, String> {

    List<TradeEntity> findByStatus(TradeStatus status);

    List<TradeEntity> findByPositionIdOrderByExecutedAtAsc(String positionId);
}
