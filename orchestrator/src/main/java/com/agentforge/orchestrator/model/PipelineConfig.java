package com.agentforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-stage configuration of one task, keyed by stage.
 *
 * Immutable; {@link #with} returns a modified copy. Stages without an entry
 * are treated as disabled.
 */
public record PipelineConfig(Map<StageId, StageConfig> stages) {

    public PipelineConfig {
        EnumMap<StageId, StageConfig> copy = new EnumMap<>(StageId.class);
        if (stages != null) copy.putAll(stages);
        stages = Collections.unmodifiableMap(copy);
    }

    public static PipelineConfig empty() {
        return new PipelineConfig(Map.of());
    }

    public StageConfig stage(StageId stage) {
        return stages.getOrDefault(stage, StageConfig.disabled());
    }

    public PipelineConfig with(StageId stage, StageConfig config) {
        EnumMap<StageId, StageConfig> copy = new EnumMap<>(StageId.class);
        copy.putAll(stages);
        copy.put(stage, config);
        return new PipelineConfig(copy);
    }

    /** The {stage: enabled} view used for enablement validation. */
    @JsonIgnore
    public Map<StageId, Boolean> enablement() {
        EnumMap<StageId, Boolean> flags = new EnumMap<>(StageId.class);
        stages.forEach((stage, cfg) -> flags.put(stage, cfg.enabled()));
        return flags;
    }
}
