package com.agentforge.orchestrator.model;

import com.agentforge.orchestrator.model.converter.JsonMapConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One (task, stage) entry in a stage's priority queue.
 *
 * Workers claim a QUEUED item with a conditional UPDATE on status (see
 * QueueItemRepository#claim), set worker_id and heartbeat_at, and finish it
 * as DONE or FAILED.
 *
 * {@code active_key} is "taskId:stage" while the item is QUEUED or
 * PROCESSING and NULL afterwards. Its UNIQUE constraint keeps at most one
 * active item per (task, stage) even when two enqueues race.
 *
 * DB table: queue_items  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "queue_items")
public class QueueItem {

    public static final int MIN_PRIORITY     = 1;
    public static final int MAX_PRIORITY     = 10;
    public static final int DEFAULT_PRIORITY = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "task_id", nullable = false)
    private UUID taskId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StageId stage;

    @Column(nullable = false)
    private int priority = DEFAULT_PRIORITY;

    // user_set, manual_boost, review_bump, rework, aging, promote ...
    @Column(name = "priority_reason", nullable = false)
    private String priorityReason = "user_set";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private QueueItemStatus status = QueueItemStatus.QUEUED;

    @Column(name = "active_key", unique = true)
    private String activeKey;

    // Snapshot of the task context when the item was enqueued.
    @Convert(converter = JsonMapConverter.class)
    @Column(nullable = false)
    private Map<String, Object> context = new LinkedHashMap<>();

    // Redeliveries after a worker stopped heartbeating.
    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "error_message")
    private String errorMessage;

    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    @Column(name = "enqueued_at", nullable = false, updatable = false)
    private Instant enqueuedAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected QueueItem() {}   // required by JPA

    public QueueItem(UUID taskId, StageId stage, Map<String, Object> context,
                     int priority, String priorityReason, Instant enqueuedAt) {
        this.taskId         = taskId;
        this.stage          = stage;
        this.context        = context == null ? new LinkedHashMap<>() : new LinkedHashMap<>(context);
        this.priority       = clamp(priority);
        this.priorityReason = priorityReason;
        this.enqueuedAt     = enqueuedAt;
        this.activeKey      = activeKey(taskId, stage);
    }

    public static int clamp(int priority) {
        return Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, priority));
    }

    public static String activeKey(UUID taskId, StageId stage) {
        return taskId + ":" + stage.name();
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public void markDone(Instant now) {
        this.status      = QueueItemStatus.DONE;
        this.completedAt = now;
        this.activeKey   = null;
        this.workerId    = null;
    }

    public void markFailed(String error, Instant now) {
        this.status       = QueueItemStatus.FAILED;
        this.errorMessage = error;
        this.completedAt  = now;
        this.activeKey    = null;
        this.workerId     = null;
    }

    /** Hand a PROCESSING item back to the queue after its worker went silent. */
    public void requeue(String reason) {
        this.status       = QueueItemStatus.QUEUED;
        this.errorMessage = reason;
        this.workerId     = null;
        this.startedAt    = null;
        this.heartbeatAt  = null;
        this.retryCount++;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID            getId()             { return id; }
    public UUID            getTaskId()         { return taskId; }
    public StageId         getStage()          { return stage; }
    public int             getPriority()       { return priority; }
    public String          getPriorityReason() { return priorityReason; }
    public QueueItemStatus getStatus()         { return status; }
    public String          getActiveKey()      { return activeKey; }
    public Map<String, Object> getContext()    { return context; }
    public int             getRetryCount()     { return retryCount; }
    public String          getErrorMessage()   { return errorMessage; }
    public String          getWorkerId()       { return workerId; }
    public Instant         getHeartbeatAt()    { return heartbeatAt; }
    public Instant         getEnqueuedAt()     { return enqueuedAt; }
    public Instant         getStartedAt()      { return startedAt; }
    public Instant         getCompletedAt()    { return completedAt; }

    public void setPriority(int priority, String reason) {
        this.priority       = clamp(priority);
        this.priorityReason = reason;
    }

    public void setHeartbeatAt(Instant t)            { this.heartbeatAt = t; }
}
