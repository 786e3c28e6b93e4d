package com.agentforge.orchestrator.model.converter;

import com.agentforge.orchestrator.model.PipelineConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class PipelineConfigConverter extends JsonColumnConverter<PipelineConfig> {

    public PipelineConfigConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected PipelineConfig emptyValue() {
        return PipelineConfig.empty();
    }
}
