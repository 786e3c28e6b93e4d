package com.agentforge.orchestrator.model.converter;

import com.agentforge.orchestrator.model.StageId;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/** Stores an ordered stage list as a comma-separated column, e.g. {@code SCRIBE,ARCHITECT}. */
@Converter
public class StageListConverter implements AttributeConverter<List<StageId>, String> {

    @Override
    public String convertToDatabaseColumn(List<StageId> stages) {
        if (stages == null) return null;
        return stages.stream().map(StageId::name).collect(Collectors.joining(","));
    }

    @Override
    public List<StageId> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) return List.of();
        return Arrays.stream(column.split(","))
                .map(String::trim)
                .map(StageId::valueOf)
                .toList();
    }
}
