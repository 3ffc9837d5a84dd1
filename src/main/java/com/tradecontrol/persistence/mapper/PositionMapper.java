package com.tradecontrol.persistence.mapper;

import com.tradecontrol.domain.model.Position;
import com.tradecontrol.persistence.entity.PositionEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface PositionMapper {

    PositionEntity toEntity(Position position);

    Position toDomain(PositionEntity entity);

    List<Position> toDomainList(List<PositionEntity> entities);
}
