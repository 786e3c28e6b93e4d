package com.agentforge.orchestrator.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/** Request body for PATCH /queues/items/{id}/priority. */
public record PriorityRequest(
        @NotNull @Min(1) @Max(10) Integer priority,
        String reason
) {
    public PriorityRequest {
        if (reason == null || reason.isBlank()) reason = "user_set";
    }
}
