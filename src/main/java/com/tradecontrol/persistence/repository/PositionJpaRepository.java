package com.tradecontrol.persistence.repository;

import com.tradecontrol.domain.enums.PositionStatus;
import com.tradecontrol.persistence.entity.PositionEntity;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, String> {

    List<PositionEntity> findByStatusIn(Collection<PositionStatus> statuses);

    List<PositionEntity> findByStatusOrderByClosedAtDesc(PositionStatus status, Pageable pageable);

    long countByStatus(PositionStatus status);

    @Query("SELECT COALESCE(SUM(p.realizedPnl), 0) FROM PositionEntity p "
            + "WHERE p.status = :status AND p.closedAt >= :since")
    BigDecimal sumRealizedPnlSince(@Param("status") PositionStatus status, @Param("since") Instant since);
}
