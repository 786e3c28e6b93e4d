package com.agentforge.orchestrator.service;

import com.agentforge.orchestrator.approval.ApprovalService;
import com.agentforge.orchestrator.error.InvalidStateException;
import com.agentforge.orchestrator.model.QueueItem;
import com.agentforge.orchestrator.model.StageConfig;
import com.agentforge.orchestrator.model.StageId;
import com.agentforge.orchestrator.model.Task;
import com.agentforge.orchestrator.model.TaskStatus;
import com.agentforge.orchestrator.pipeline.StageRegistry;
import com.agentforge.orchestrator.pipeline.StageRegistry.ResolvedPipeline;
import com.agentforge.orchestrator.queue.QueueService;
import com.agentforge.orchestrator.queue.StallRecovery;
import com.agentforge.orchestrator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Task lifecycle entry points: creation, cancellation and stalled-worker
 * recovery. Status changes themselves go through {@link TaskStateMachine}.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    static final String CANCELLED_MESSAGE = "Task cancelled";

    private final TaskRepository   taskRepo;
    private final TaskStateMachine stateMachine;
    private final QueueService     queueService;
    private final ApprovalService  approvalService;
    private final StageRegistry    stageRegistry;
    private final Clock            clock;

    public TaskService(TaskRepository taskRepo,
                       TaskStateMachine stateMachine,
                       QueueService queueService,
                       ApprovalService approvalService,
                       StageRegistry stageRegistry,
                       Clock clock) {
        this.taskRepo        = taskRepo;
        this.stateMachine    = stateMachine;
        this.queueService    = queueService;
        this.approvalService = approvalService;
        this.stageRegistry   = stageRegistry;
        this.clock           = clock;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Validate the stage configuration, persist the task (PENDING) and put it
     * in the first enabled stage's queue.
     *
     * @param priority base priority of the task's queue items; null means the default
     * @throws com.agentforge.orchestrator.error.ConfigurationException on an
     *         invalid stage configuration; nothing is persisted in that case
     */
    @Transactional
    public Task create(String title, String description, Map<String, StageConfig> stages,
                       Integer priority) {
        ResolvedPipeline pipeline = stageRegistry.resolve(stages);
        int base = QueueItem.clamp(priority == null ? QueueItem.DEFAULT_PRIORITY : priority);

        Task task = stateMachine.register(
                new Task(title, description, pipeline.enabledStages(), pipeline.config(), base));
        StageId first = pipeline.enabledStages().get(0);
        queueService.enqueue(task.getId(), first, task.snapshotContext(), base, "user_set");

        log.info("Task {} created: stages={}, priority={}", task.getId(), pipeline.enabledStages(), base);
        return task;
    }

    @Transactional(readOnly = true)
    public Optional<Task> findById(UUID id) {
        return taskRepo.findById(id);
    }

    @Transactional(readOnly = true)
    public List<Task> list(TaskStatus status) {
        return status == null
                ? taskRepo.findAllByOrderByCreatedAtDesc()
                : taskRepo.findByStatusOrderByCreatedAtDesc(status);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Cancel a task in one transaction: withdraw its QUEUED items and its
     * PENDING approval, then mark it CANCELLED. An item a worker is running
     * right now is reconciled by that worker once the stage returns.
     *
     * @throws InvalidStateException if the task is already terminal
     */
    @Transactional
    public Task cancel(UUID taskId) {
        Task task = stateMachine.get(taskId);
        if (task.getStatus().isTerminal()) {
            throw new InvalidStateException("Task " + taskId + " is already " + task.getStatus());
        }
        queueService.cancelQueued(taskId, CANCELLED_MESSAGE);
        approvalService.cancelPending(taskId);
        return stateMachine.cancel(taskId, CANCELLED_MESSAGE);
    }

    // ------------------------------------------------------------------
    // Stalled workers
    // ------------------------------------------------------------------

    /**
     * Hand items of silently dead workers back to their queues. An item that
     * ran out of deliveries fails its task.
     */
    @Transactional
    public StallRecovery recoverStalledItems() {
        StallRecovery recovery = queueService.recoverStalled(clock.instant());

        recovery.requeued().forEach(stateMachine::recordRedelivery);
        for (QueueItem item : recovery.exhausted()) {
            stateMachine.recordRedelivery(item);
            Task task = stateMachine.get(item.getTaskId());
            if (!task.getStatus().isTerminal()) {
                stateMachine.fail(task.getId(), "Stage " + item.getStage().id()
                        + " failed: " + item.getErrorMessage());
            }
        }

        if (!recovery.isEmpty()) {
            log.warn("Stall recovery: {} item(s) requeued, {} item(s) failed",
                    recovery.requeued().size(), recovery.exhausted().size());
        }
        return recovery;
    }
}
