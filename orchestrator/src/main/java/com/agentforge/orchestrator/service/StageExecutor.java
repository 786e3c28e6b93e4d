package com.agentforge.orchestrator.service;

import com.agentforge.orchestrator.agent.StageAgentRegistry;
import com.agentforge.orchestrator.agent.StageResult;
import com.agentforge.orchestrator.approval.ApprovalService;
import com.agentforge.orchestrator.error.NotFoundException;
import com.agentforge.orchestrator.error.StageExecutionException;
import com.agentforge.orchestrator.model.QueueItem;
import com.agentforge.orchestrator.model.QueueItemStatus;
import com.agentforge.orchestrator.model.StageConfig;
import com.agentforge.orchestrator.model.StageId;
import com.agentforge.orchestrator.model.Task;
import com.agentforge.orchestrator.model.TaskStatus;
import com.agentforge.orchestrator.queue.QueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one claimed queue item: one stage of one task.
 *
 * For a given item, this class:
 *   1. Skips it if the task no longer expects this stage (stale or redelivered item)
 *   2. Moves the task into the stage and calls the stage agent, outside any transaction
 *   3. In one transaction: stores the output, marks the item DONE and then
 *      opens a checkpoint, sends the stage round again (fix needed), or advances
 *
 * Nothing is kept between items. A task suspended at a checkpoint is
 * resumed by {@link ApprovalService} enqueuing the next stage.
 */
@Component
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    static final String CANCELLED_DURING_EXECUTION = "Task cancelled during execution";

    private final TaskStateMachine    stateMachine;
    private final QueueService        queueService;
    private final ApprovalService     approvalService;
    private final StageAgentRegistry  agents;
    private final TransactionTemplate tx;
    private final int                 maxFixIterations;

    public StageExecutor(TaskStateMachine stateMachine,
                         QueueService queueService,
                         ApprovalService approvalService,
                         StageAgentRegistry agents,
                         TransactionTemplate tx,
                         @Value("${agentforge.executor.max-fix-iterations:3}") int maxFixIterations) {
        this.stateMachine     = stateMachine;
        this.queueService     = queueService;
        this.approvalService  = approvalService;
        this.agents           = agents;
        this.tx               = tx;
        this.maxFixIterations = maxFixIterations;
    }

    // ------------------------------------------------------------------
    // Entry point, called by StageDispatcher for each claimed item
    // ------------------------------------------------------------------

    public void execute(QueueItem item) {
        MDC.put("taskId", item.getTaskId().toString());
        MDC.put("itemId", item.getId().toString());
        MDC.put("stage",  item.getStage().id());
        try {
            run(item);
        } finally {
            MDC.clear();
        }
    }

    private void run(QueueItem item) {
        UUID taskId = item.getTaskId();
        StageId stage = item.getStage();

        Optional<String> staleReason = staleReason(item);
        if (staleReason.isPresent()) {
            log.warn("Skipping item {}: {}", item.getId(), staleReason.get());
            queueService.markFailed(item.getId(), staleReason.get());
            return;
        }

        Task task = stateMachine.startStage(taskId, stage);
        StageConfig config = task.getConfig().stage(stage);
        log.info("Running stage {} for task {} (delivery {})", stage.id(), taskId, item.getRetryCount() + 1);

        long started = System.currentTimeMillis();
        StageResult result;
        try {
            result = agents.execute(stage, config, task.snapshotContext());
        } catch (StageExecutionException e) {
            log.error("Stage {} failed for task {}: {}", stage.id(), taskId, e.getMessage(), e);
            tx.executeWithoutResult(status -> recordFailure(item, e.getMessage()));
            return;
        }
        long durationMs = System.currentTimeMillis() - started;

        tx.executeWithoutResult(status -> complete(item, result, config, durationMs));
    }

    /**
     * Last resort for an item whose run blew up outside the normal outcomes.
     * Fails the item and its task unless someone else already finished it.
     */
    public void abandon(QueueItem item, Exception cause) {
        String message = "Unhandled exception: " + cause.getMessage();
        try {
            tx.executeWithoutResult(status -> {
                if (queueService.get(item.getId()).getStatus() == QueueItemStatus.PROCESSING) {
                    recordFailure(item, message);
                }
            });
        } catch (RuntimeException e) {
            log.error("Could not fail item {} after an unhandled error; stall recovery will pick it up",
                    item.getId(), e);
        }
    }

    // ------------------------------------------------------------------
    // Outcomes
    // ------------------------------------------------------------------

    private void complete(QueueItem item, StageResult result, StageConfig config, long durationMs) {
        UUID taskId = item.getTaskId();
        StageId stage = item.getStage();

        Task task = stateMachine.get(taskId);
        if (task.getStatus() != TaskStatus.PROCESSING) {
            log.info("Task {} is {} now; discarding {} result", taskId, task.getStatus(), stage.id());
            queueService.markFailed(item.getId(), CANCELLED_DURING_EXECUTION);
            return;
        }

        stateMachine.recordStageResult(taskId, stage, result.toOutput(),
                result.usage().tokens(), result.usage().cost(), durationMs);
        queueService.markDone(item.getId());
        log.info("Stage {} finished for task {} in {} ms ({})",
                stage.id(), taskId, durationMs, result.status());

        if (result.isFixNeeded()) {
            if (task.getReworkCount() >= maxFixIterations) {
                stateMachine.fail(taskId, "Stage " + stage.id() + " failed: still needs fixes after "
                        + maxFixIterations + " rework rounds: " + result.outputSummary());
                return;
            }
            Map<String, Object> feedback = new LinkedHashMap<>();
            feedback.put("fix_needed", result.outputSummary());
            feedback.put("iteration", task.getReworkCount() + 1);
            stateMachine.reworkAfterFix(taskId, stage, feedback);
            return;
        }

        if (config.approvalRequired()) {
            approvalService.create(taskId, stage, result.artifacts(), result.outputSummary(),
                    result.details(), config.effectiveTimeoutMinutes(), config.autoApproveOnTimeout());
            return;
        }

        stateMachine.advanceAfter(taskId, stage);
    }

    private void recordFailure(QueueItem item, String message) {
        Task task = stateMachine.get(item.getTaskId());
        if (task.getStatus() != TaskStatus.PROCESSING) {
            queueService.markFailed(item.getId(), CANCELLED_DURING_EXECUTION);
            return;
        }
        String error = "Stage " + item.getStage().id() + " failed: " + message;
        queueService.markFailed(item.getId(), error);
        stateMachine.fail(task.getId(), error);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Why this item must not run, or empty if the task is waiting for exactly this stage. */
    private Optional<String> staleReason(QueueItem item) {
        Task task;
        try {
            task = stateMachine.get(item.getTaskId());
        } catch (NotFoundException e) {
            return Optional.of("Task " + item.getTaskId() + " does not exist");
        }
        TaskStatus status = task.getStatus();
        if (status != TaskStatus.PENDING && status != TaskStatus.PROCESSING) {
            return Optional.of("Stale item: task is " + status);
        }
        if (item.getStage() != task.effectiveStage()) {
            return Optional.of("Stale item: task is at stage " + task.effectiveStage().id()
                    + ", not " + item.getStage().id());
        }
        return Optional.empty();
    }
}
