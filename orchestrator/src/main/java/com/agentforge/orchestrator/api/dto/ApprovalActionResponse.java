package com.agentforge.orchestrator.api.dto;

import com.agentforge.orchestrator.model.ApprovalAction;
import com.agentforge.orchestrator.model.ApprovalStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record ApprovalActionResponse(
        UUID                id,
        UUID                requestId,
        String              checkpoint,
        ApprovalStatus      action,
        String              actor,
        String              comment,
        Map<String, Object> feedback,
        Instant             createdAt
) {
    public static ApprovalActionResponse from(ApprovalAction a) {
        return new ApprovalActionResponse(
                a.getId(),
                a.getRequest().getId(),
                a.getRequest().getCheckpoint(),
                a.getAction(),
                a.getActor(),
                a.getComment(),
                a.getFeedback(),
                a.getCreatedAt()
        );
    }
}
