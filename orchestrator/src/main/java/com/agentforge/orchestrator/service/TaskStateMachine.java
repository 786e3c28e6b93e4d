package com.agentforge.orchestrator.service;

import com.agentforge.orchestrator.error.InvalidStateException;
import com.agentforge.orchestrator.error.NotFoundException;
import com.agentforge.orchestrator.event.TaskStatusEvent;
import com.agentforge.orchestrator.model.QueueItem;
import com.agentforge.orchestrator.model.StageConfig;
import com.agentforge.orchestrator.model.StageId;
import com.agentforge.orchestrator.model.Task;
import com.agentforge.orchestrator.model.TaskStatus;
import com.agentforge.orchestrator.queue.QueueService;
import com.agentforge.orchestrator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * The only writer of a task's status and current-stage pointer.
 *
 * Every transition is checked against {@link TaskStatus#canTransitionTo}
 * and publishes a {@link TaskStatusEvent}. Moving a task into a stage and
 * enqueuing that stage's queue item happen in the same transaction, so a
 * PROCESSING task between stages always has an active item waiting for it.
 */
@Service
public class TaskStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TaskStateMachine.class);

    /** Extra priority given to a stage that has to run again after a rejection or fix request. */
    public static final int REWORK_BUMP = 2;

    private final TaskRepository            taskRepo;
    private final QueueService              queueService;
    private final ApplicationEventPublisher events;
    private final Clock                     clock;

    public TaskStateMachine(TaskRepository taskRepo,
                            QueueService queueService,
                            ApplicationEventPublisher events,
                            Clock clock) {
        this.taskRepo     = taskRepo;
        this.queueService = queueService;
        this.events       = events;
        this.clock        = clock;
    }

    @Transactional(readOnly = true)
    public Task get(UUID taskId) {
        return taskRepo.findById(taskId).orElseThrow(() -> NotFoundException.of("Task", taskId));
    }

    /** Persist a freshly created (PENDING) task and announce it. */
    @Transactional
    public Task register(Task task) {
        Task saved = taskRepo.save(task);
        publish(saved, "Task created");
        return saved;
    }

    // ------------------------------------------------------------------
    // Stage execution
    // ------------------------------------------------------------------

    /** A worker picked up {@code stage}: PENDING/PROCESSING → PROCESSING. */
    @Transactional
    public Task startStage(UUID taskId, StageId stage) {
        Task task = get(taskId);
        transition(task, TaskStatus.PROCESSING, stage, "Stage " + stage.id() + " started");
        return task;
    }

    /** Store a stage's output under {@code <stage>_output} and add its usage. */
    @Transactional
    public Task recordStageResult(UUID taskId, StageId stage, Map<String, Object> output,
                                  long tokens, double cost, long durationMs) {
        Task task = get(taskId);
        task.putContext(stage.outputKey(), output);
        task.addUsage(stage, tokens, cost, durationMs);
        return taskRepo.save(task);
    }

    /**
     * Move past {@code stage}: enqueue the next enabled stage, or complete the
     * task if {@code stage} was the last one. Used both right after a stage
     * without a checkpoint and when a checkpoint is approved.
     *
     * The stage's rejection feedback is dropped once the stage is passed. A
     * task approved at its last checkpoint resumes to PROCESSING before it
     * completes.
     */
    @Transactional
    public Task advanceAfter(UUID taskId, StageId stage) {
        Task task = get(taskId);
        StageId next = task.stageAfter(stage);

        StageConfig passed = task.getConfig().stage(stage);
        if (passed.hasRejectionFeedback()) {
            task.setConfig(task.getConfig().with(stage, passed.withoutRejectionFeedback()));
        }

        if (next == null) {
            if (task.getStatus().isAwaiting()) {
                transition(task, TaskStatus.PROCESSING, stage, "Checkpoint " + stage.checkpoint() + " approved");
            }
            transition(task, TaskStatus.COMPLETED, stage, "All stages finished");
            task.setCompletedAt(clock.instant());
            log.info("Task {} COMPLETED after {}", taskId, stage.id());
            return taskRepo.save(task);
        }

        transition(task, TaskStatus.PROCESSING, next, "Advancing to " + next.id());
        queueService.enqueue(taskId, next, task.snapshotContext(), task.getPriority(), "user_set");
        log.info("Task {} advancing {} -> {}", taskId, stage.id(), next.id());
        return task;
    }

    // ------------------------------------------------------------------
    // Checkpoints
    // ------------------------------------------------------------------

    /** Park the task at a checkpoint until a decision arrives. */
    @Transactional
    public Task suspend(UUID taskId, StageId stage) {
        Task task = get(taskId);
        TaskStatus waiting = stage == StageId.PHOENIX
                ? TaskStatus.AWAITING_RELEASE
                : TaskStatus.AWAITING_REVIEW;
        transition(task, waiting, stage, "Waiting for approval at " + stage.checkpoint());
        log.info("Task {} suspended at checkpoint {}", taskId, stage.checkpoint());
        return task;
    }

    /**
     * Run {@code stage} again with {@code feedback} merged into its
     * rejection feedback. The re-enqueued item gets the task's priority plus
     * {@link #REWORK_BUMP}.
     */
    @Transactional
    public Task rework(UUID taskId, StageId stage, Map<String, Object> feedback, String reason) {
        Task task = get(taskId);
        StageConfig merged = task.getConfig().stage(stage).withRejectionFeedback(feedback);
        task.setConfig(task.getConfig().with(stage, merged));
        transition(task, TaskStatus.PROCESSING, stage, "Rework of " + stage.id() + " (" + reason + ")");
        queueService.enqueue(taskId, stage, task.snapshotContext(),
                task.getPriority() + REWORK_BUMP, reason);
        log.info("Task {} sent back to {} ({})", taskId, stage.id(), reason);
        return task;
    }

    /** A stage reported that its own output needs fixing; counts as one retry and one rework round. */
    @Transactional
    public Task reworkAfterFix(UUID taskId, StageId stage, Map<String, Object> feedback) {
        Task task = get(taskId);
        task.recordRework();
        taskRepo.save(task);
        return rework(taskId, stage, feedback, "rework");
    }

    // ------------------------------------------------------------------
    // Terminal transitions
    // ------------------------------------------------------------------

    @Transactional
    public Task fail(UUID taskId, String errorMessage) {
        Task task = get(taskId);
        transition(task, TaskStatus.FAILED, task.getCurrentStage(), errorMessage);
        task.setErrorMessage(errorMessage);
        task.setCompletedAt(clock.instant());
        log.error("Task {} FAILED: {}", taskId, errorMessage);
        return taskRepo.save(task);
    }

    @Transactional
    public Task cancel(UUID taskId, String reason) {
        Task task = get(taskId);
        transition(task, TaskStatus.CANCELLED, task.getCurrentStage(), reason);
        task.setCompletedAt(clock.instant());
        log.info("Task {} CANCELLED: {}", taskId, reason);
        return taskRepo.save(task);
    }

    /** A stalled worker's item went back to its queue. */
    @Transactional
    public void recordRedelivery(QueueItem item) {
        Task task = get(item.getTaskId());
        task.incrementRetryCount();
        taskRepo.save(task);
        log.warn("Task {} stage {} redelivered (delivery {})",
                task.getId(), item.getStage().id(), item.getRetryCount() + 1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void transition(Task task, TaskStatus next, StageId stage, String message) {
        TaskStatus current = task.getStatus();
        if (!current.canTransitionTo(next)) {
            throw new InvalidStateException("Task " + task.getId() + " cannot move from "
                    + current + " to " + next);
        }
        task.setStatus(next);
        task.setCurrentStage(stage);
        taskRepo.save(task);
        publish(task, message);
        log.debug("Task {} {} -> {} (stage={})", task.getId(), current, next,
                stage == null ? "-" : stage.id());
    }

    private void publish(Task task, String message) {
        events.publishEvent(new TaskStatusEvent(task.getId(), task.getStatus(),
                task.getCurrentStage(), message, clock.instant()));
    }
}
