package com.agentforge.orchestrator.api.dto;

import com.agentforge.orchestrator.model.StageId;
import com.agentforge.orchestrator.model.StageMetrics;
import com.agentforge.orchestrator.model.Task;
import com.agentforge.orchestrator.model.TaskStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Response body for the /tasks endpoints. Stages are reported by their lowercase id. */
public record TaskResponse(
        UUID                      id,
        String                    title,
        String                    description,
        TaskStatus                status,
        String                    currentStage,
        List<String>              enabledStages,
        int                       priority,
        Map<String, Object>       context,
        Map<String, StageMetrics> stageMetrics,
        long                      totalTokens,
        double                    totalCost,
        String                    errorMessage,
        int                       retryCount,
        int                       reworkCount,
        Instant                   createdAt,
        Instant                   updatedAt,
        Instant                   completedAt
) {
    public static TaskResponse from(Task t) {
        Map<String, StageMetrics> metrics = new LinkedHashMap<>();
        t.getStageMetrics().forEach((stage, m) -> metrics.put(stage.id(), m));
        return new TaskResponse(
                t.getId(),
                t.getTitle(),
                t.getDescription(),
                t.getStatus(),
                t.getCurrentStage() == null ? null : t.getCurrentStage().id(),
                t.getEnabledStages().stream().map(StageId::id).toList(),
                t.getPriority(),
                t.getContext(),
                metrics,
                t.getTotalTokens(),
                t.getTotalCost(),
                t.getErrorMessage(),
                t.getRetryCount(),
                t.getReworkCount(),
                t.getCreatedAt(),
                t.getUpdatedAt(),
                t.getCompletedAt()
        );
    }
}
