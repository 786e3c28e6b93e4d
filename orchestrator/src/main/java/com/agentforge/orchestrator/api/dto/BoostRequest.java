package com.agentforge.orchestrator.api.dto;

import jakarta.validation.constraints.Min;

/** Request body for POST /queues/items/{id}/boost; delta defaults to 1. */
public record BoostRequest(@Min(1) Integer delta, String reason) {

    public BoostRequest {
        if (delta == null) delta = 1;
        if (reason == null || reason.isBlank()) reason = "manual_boost";
    }
}
