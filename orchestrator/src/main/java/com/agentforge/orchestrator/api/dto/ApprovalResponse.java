package com.agentforge.orchestrator.api.dto;

import com.agentforge.orchestrator.model.ApprovalRequest;
import com.agentforge.orchestrator.model.ApprovalStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for the /approvals endpoints.
 * {@code actions} is only present on GET /approvals/{id}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApprovalResponse(
        UUID                         id,
        UUID                         taskId,
        String                       stage,
        String                       checkpoint,
        ApprovalStatus               status,
        int                          priority,
        List<String>                 artifacts,
        String                       summary,
        Map<String, Object>          details,
        boolean                      autoApproveOnTimeout,
        Instant                      createdAt,
        Instant                      timeoutAt,
        Instant                      resolvedAt,
        List<ApprovalActionResponse> actions
) {
    public static ApprovalResponse from(ApprovalRequest r) {
        return of(r, null);
    }

    public static ApprovalResponse withActions(ApprovalRequest r) {
        return of(r, r.getActions().stream().map(ApprovalActionResponse::from).toList());
    }

    private static ApprovalResponse of(ApprovalRequest r, List<ApprovalActionResponse> actions) {
        return new ApprovalResponse(
                r.getId(),
                r.getTaskId(),
                r.getStage().id(),
                r.getCheckpoint(),
                r.getStatus(),
                r.getPriority(),
                r.getArtifacts(),
                r.getSummary(),
                r.getDetails(),
                r.isAutoApproveOnTimeout(),
                r.getCreatedAt(),
                r.getTimeoutAt(),
                r.getResolvedAt(),
                actions
        );
    }
}
