package com.agentforge.orchestrator.model.converter;

import com.agentforge.orchestrator.model.StageId;
import com.agentforge.orchestrator.model.StageMetrics;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.EnumMap;
import java.util.Map;

@Converter
public class StageMetricsConverter extends JsonColumnConverter<Map<StageId, StageMetrics>> {

    public StageMetricsConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected Map<StageId, StageMetrics> emptyValue() {
        return new EnumMap<>(StageId.class);
    }
}
