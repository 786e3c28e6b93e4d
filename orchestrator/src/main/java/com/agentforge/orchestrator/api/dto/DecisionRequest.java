package com.agentforge.orchestrator.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Request body for approving or rejecting a checkpoint.
 * A rejection needs a comment; the service enforces that.
 */
public record DecisionRequest(
        @NotBlank String actor,
        String comment,
        Map<String, Object> feedback
) {}
