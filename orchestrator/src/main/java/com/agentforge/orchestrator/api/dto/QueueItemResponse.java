package com.agentforge.orchestrator.api.dto;

import com.agentforge.orchestrator.model.QueueItem;
import com.agentforge.orchestrator.model.QueueItemStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a queue item. The context snapshot is left out: it can
 * be large and is visible on the task itself.
 */
public record QueueItemResponse(
        UUID            id,
        UUID            taskId,
        String          stage,
        int             priority,
        String          priorityReason,
        QueueItemStatus status,
        int             retryCount,
        String          errorMessage,
        String          workerId,
        Instant         enqueuedAt,
        Instant         startedAt,
        Instant         heartbeatAt,
        Instant         completedAt
) {
    public static QueueItemResponse from(QueueItem i) {
        return new QueueItemResponse(
                i.getId(),
                i.getTaskId(),
                i.getStage().id(),
                i.getPriority(),
                i.getPriorityReason(),
                i.getStatus(),
                i.getRetryCount(),
                i.getErrorMessage(),
                i.getWorkerId(),
                i.getEnqueuedAt(),
                i.getStartedAt(),
                i.getHeartbeatAt(),
                i.getCompletedAt()
        );
    }
}
