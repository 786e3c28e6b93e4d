package com.agentforge.orchestrator.api.dto;

import com.agentforge.orchestrator.model.StageConfig;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.Map;

/**
 * Request body for POST /tasks.
 *
 * {@code stages} maps a stage id ("scribe", "architect", ...) to its
 * configuration. Enabled stages must form a prefix of the pipeline order.
 * {@code priority} defaults to 5.
 */
public record CreateTaskRequest(
        @NotBlank String title,
        String description,
        @NotEmpty Map<String, StageConfig> stages,
        @Min(1) @Max(10) Integer priority
) {}
