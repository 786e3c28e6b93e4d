package com.agentforge.orchestrator.queue;

import com.agentforge.orchestrator.model.QueueItem;
import com.agentforge.orchestrator.model.QueueItemStatus;
import com.agentforge.orchestrator.model.StageId;
import com.agentforge.orchestrator.repository.QueueItemRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * "What is each stage doing right now", derived from the queue tables on
 * every call. Nothing is held in memory, so every orchestrator instance
 * reports the same picture and it survives restarts.
 */
@Component
public class StageActivityProjection {

    private final QueueItemRepository repo;

    public StageActivityProjection(QueueItemRepository repo) {
        this.repo = repo;
    }

    @Transactional(readOnly = true)
    public List<StageActivity> snapshot() {
        return StageId.ORDERED.stream().map(this::activityOf).toList();
    }

    private StageActivity activityOf(StageId stage) {
        List<QueueItem> items = repo.findByStageAndStatusInOrderByPriorityDescEnqueuedAtAsc(
                stage, EnumSet.of(QueueItemStatus.QUEUED, QueueItemStatus.PROCESSING));

        List<Running> running = items.stream()
                .filter(i -> i.getStatus() == QueueItemStatus.PROCESSING)
                .map(i -> new Running(i.getTaskId(), i.getId(), i.getWorkerId(), i.getStartedAt()))
                .toList();
        Next next = items.stream()
                .filter(i -> i.getStatus() == QueueItemStatus.QUEUED)
                .findFirst()
                .map(i -> new Next(i.getTaskId(), i.getId(), i.getPriority(), i.getEnqueuedAt()))
                .orElse(null);
        long waiting = items.stream().filter(i -> i.getStatus() == QueueItemStatus.QUEUED).count();

        return new StageActivity(stage, running.isEmpty() ? "idle" : "running", running, next, waiting);
    }

    public record StageActivity(StageId stage, String state, List<Running> running, Next next, long waiting) {}

    public record Running(UUID taskId, UUID itemId, String workerId, Instant startedAt) {}

    public record Next(UUID taskId, UUID itemId, int priority, Instant enqueuedAt) {}
}
