package com.agentforge.orchestrator.pipeline;

import com.agentforge.orchestrator.error.ConfigurationException;
import com.agentforge.orchestrator.model.PipelineConfig;
import com.agentforge.orchestrator.model.StageConfig;
import com.agentforge.orchestrator.model.StageId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The fixed stage order and the rule that a task's enabled stages form a
 * contiguous prefix of it.
 *
 * Validation runs once, when a task is created. The resulting stage list is
 * stored on the task and never re-validated.
 */
@Component
public class StageRegistry {

    /** Execution order of the pipeline. */
    public static final List<StageId> ORDER = StageId.ORDERED;

    /**
     * Compute the ordered list of enabled stages.
     *
     * Stages missing from {@code enablement} count as disabled.
     *
     * @throws ConfigurationException if nothing is enabled, or an enabled
     *         stage follows a disabled one
     */
    public List<StageId> enabledStages(Map<StageId, Boolean> enablement) {
        List<StageId> enabled = new ArrayList<>();
        StageId firstDisabled = null;

        for (StageId stage : ORDER) {
            if (Boolean.TRUE.equals(enablement.get(stage))) {
                if (firstDisabled != null) {
                    throw new ConfigurationException("Cannot enable " + stage.id() + ": "
                            + firstDisabled.id() + " is disabled and stages must be enabled "
                            + "in order without gaps");
                }
                enabled.add(stage);
            } else if (firstDisabled == null) {
                firstDisabled = stage;
            }
        }

        if (enabled.isEmpty()) {
            throw new ConfigurationException("At least one stage must be enabled");
        }
        return List.copyOf(enabled);
    }

    /**
     * Parse and validate a raw {stageId: config} map as submitted by a client.
     *
     * Keys may be the lowercase stage id or the enum name. Unknown keys,
     * duplicate keys and out-of-range settings are rejected here instead of
     * surfacing later in a worker.
     */
    public ResolvedPipeline resolve(Map<String, StageConfig> requested) {
        if (requested == null || requested.isEmpty()) {
            throw new ConfigurationException("At least one stage must be enabled");
        }

        Map<StageId, StageConfig> stages = new EnumMap<>(StageId.class);
        requested.forEach((key, cfg) -> {
            StageId stage = StageId.fromId(key).orElseThrow(() -> new ConfigurationException(
                    "Unknown stage '" + key + "'. Valid stages: " + validIds()));
            if (stages.containsKey(stage)) {
                throw new ConfigurationException("Stage " + stage.id() + " is configured twice");
            }
            stages.put(stage, cfg == null ? StageConfig.disabled() : cfg);
        });

        PipelineConfig config = new PipelineConfig(stages);
        List<StageId> enabled = enabledStages(config.enablement());
        enabled.forEach(stage -> validate(stage, config.stage(stage)));
        return new ResolvedPipeline(config, enabled);
    }

    private static void validate(StageId stage, StageConfig cfg) {
        if (cfg.timeoutMinutes() != null && cfg.timeoutMinutes() <= 0) {
            throw new ConfigurationException(stage.id() + ": timeoutMinutes must be positive");
        }
        if (cfg.temperature() != null && (cfg.temperature() < 0.0 || cfg.temperature() > 2.0)) {
            throw new ConfigurationException(stage.id() + ": temperature must be between 0 and 2");
        }
        if (cfg.maxTokens() != null && cfg.maxTokens() <= 0) {
            throw new ConfigurationException(stage.id() + ": maxTokens must be positive");
        }
        if (cfg.autoApproveOnTimeout() && !cfg.approvalRequired()) {
            throw new ConfigurationException(stage.id()
                    + ": autoApproveOnTimeout only applies when approvalRequired is set");
        }
    }

    private static String validIds() {
        return Arrays.stream(StageId.values()).map(StageId::id).collect(Collectors.joining(", "));
    }

    /** A validated pipeline: typed config plus its enabled-stage prefix. */
    public record ResolvedPipeline(PipelineConfig config, List<StageId> enabledStages) {}
}
