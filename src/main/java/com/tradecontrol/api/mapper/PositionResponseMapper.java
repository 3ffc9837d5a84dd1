package com.tradecontrol.api.mapper;

import com.tradecontrol.api.dto.response.PositionResponse;
import com.tradecontrol.domain.model.Position;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper
public interface PositionResponseMapper {

    @Mapping(target = "unrealizedPnl", expression = "java(position.unrealizedPnl())")
    PositionResponse toResponse(Position position);

    List<PositionResponse> toResponseList(List<Position> positions);
}
