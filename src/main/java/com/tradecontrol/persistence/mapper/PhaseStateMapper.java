package com.tradecontrol.persistence.mapper;

import com.tradecontrol.domain.model.PerformanceMetrics;
import com.tradecontrol.domain.model.PhaseState;
import com.tradecontrol.persistence.entity.PhaseStateEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between {@link PhaseState} and its single-row entity. The metric
 * snapshot travels as a JSON column.
 */
@Mapper(imports = {JsonHelper.class, PhaseStateEntity.class})
public interface PhaseStateMapper {

    @Mapping(target = "id", expression = "java(PhaseStateEntity.SINGLETON_ID)")
    @Mapping(target = "metricsJson", expression = "java(JsonHelper.toJson(state.getMetrics()))")
    PhaseStateEntity toEntity(PhaseState state);

    @Mapping(target = "metrics", expression = "java(toMetrics(entity.getMetricsJson()))")
    PhaseState toDomain(PhaseStateEntity entity);

    default PerformanceMetrics toMetrics(String json) {
        PerformanceMetrics metrics = JsonHelper.fromJson(json, PerformanceMetrics.class);
        return metrics != null ? metrics : PerformanceMetrics.empty();
    }
}
