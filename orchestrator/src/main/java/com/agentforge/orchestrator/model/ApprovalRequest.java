package com.agentforge.orchestrator.model;

import com.agentforge.orchestrator.model.converter.JsonMapConverter;
import com.agentforge.orchestrator.model.converter.StringListConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A checkpoint suspension point: a stage output waiting for a human decision.
 *
 * Resolved exactly once (APPROVED, REJECTED or TIMEOUT). Every resolution
 * appends an {@link ApprovalAction}; actions are never updated.
 *
 * {@code pending_key} holds the task id while the request is PENDING and is
 * cleared on resolution. Its UNIQUE constraint backs the one-pending-request-
 * per-task rule at the store level.
 *
 * DB tables: approval_requests, approval_actions  (Flyway V1 migration)
 */
@Entity
@Table(name = "approval_requests")
public class ApprovalRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "task_id", nullable = false)
    private UUID taskId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StageId stage;

    // e.g. "sentinel_review"; denormalised from stage for filtering.
    @Column(nullable = false)
    private String checkpoint;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ApprovalStatus status = ApprovalStatus.PENDING;

    @Column(name = "pending_key", unique = true)
    private String pendingKey;

    @Convert(converter = StringListConverter.class)
    @Column(nullable = false)
    private List<String> artifacts = new ArrayList<>();

    @Column
    private String summary;

    @Convert(converter = JsonMapConverter.class)
    @Column
    private Map<String, Object> details = new LinkedHashMap<>();

    @Column(nullable = false)
    private int priority;

    @Column(name = "auto_approve_on_timeout", nullable = false)
    private boolean autoApproveOnTimeout;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    // Null means the request never times out.
    @Column(name = "timeout_at")
    private Instant timeoutAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @OneToMany(mappedBy = "request", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("createdAt ASC")
    private List<ApprovalAction> actions = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected ApprovalRequest() {}   // required by JPA

    public ApprovalRequest(UUID taskId, StageId stage, List<String> artifacts, String summary,
                           Map<String, Object> details, Instant createdAt, Instant timeoutAt,
                           boolean autoApproveOnTimeout) {
        this.taskId               = taskId;
        this.stage                = stage;
        this.checkpoint           = stage.checkpoint();
        this.priority             = stage.approvalPriority();
        this.pendingKey           = taskId.toString();
        this.artifacts            = artifacts == null ? new ArrayList<>() : new ArrayList<>(artifacts);
        this.summary              = summary;
        this.details              = details == null ? new LinkedHashMap<>() : new LinkedHashMap<>(details);
        this.createdAt            = createdAt;
        this.timeoutAt            = timeoutAt;
        this.autoApproveOnTimeout = autoApproveOnTimeout;
    }

    /**
     * Resolve the request and append the matching action.
     * The caller has already checked that the request is PENDING.
     */
    public ApprovalAction resolve(ApprovalStatus outcome, ApprovalStatus actionType, String actor,
                                  String comment, Map<String, Object> feedback, Instant now) {
        this.status     = outcome;
        this.resolvedAt = now;
        this.pendingKey = null;
        ApprovalAction action = new ApprovalAction(this, actionType, actor, comment, feedback, now);
        actions.add(action);
        return action;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID           getId()                   { return id; }
    public UUID           getTaskId()               { return taskId; }
    public StageId        getStage()                { return stage; }
    public String         getCheckpoint()           { return checkpoint; }
    public ApprovalStatus getStatus()               { return status; }
    public List<String>   getArtifacts()            { return artifacts; }
    public String         getSummary()              { return summary; }
    public Map<String, Object> getDetails()         { return details; }
    public int            getPriority()             { return priority; }
    public boolean        isAutoApproveOnTimeout()  { return autoApproveOnTimeout; }
    public Instant        getCreatedAt()            { return createdAt; }
    public Instant        getTimeoutAt()            { return timeoutAt; }
    public Instant        getResolvedAt()           { return resolvedAt; }
    public List<ApprovalAction> getActions()        { return actions; }

    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }
}
