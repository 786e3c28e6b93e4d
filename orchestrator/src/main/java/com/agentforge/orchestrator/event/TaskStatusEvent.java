package com.agentforge.orchestrator.event;

import com.agentforge.orchestrator.model.StageId;
import com.agentforge.orchestrator.model.TaskStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Published for every task status transition, including stage-to-stage
 * moves inside PROCESSING. Listeners only see it once the transaction that
 * produced it has committed.
 */
public record TaskStatusEvent(
        UUID       taskId,
        TaskStatus status,
        StageId    stage,
        String     message,
        Instant    occurredAt
) {}
