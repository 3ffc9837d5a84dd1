package com.tradecontrol.persistence.mapper;

import com.tradecontrol.domain.model.Trade;
import com.tradecontrol.persistence.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface TradeMapper {

    TradeEntity toEntity(Trade trade);

    Trade toDomain(TradeEntity entity);

    List<Trade> toDomainList(List<TradeEntity> entities);
}
