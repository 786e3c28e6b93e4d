package com.agentforge.orchestrator.model;

import com.agentforge.orchestrator.model.converter.JsonMapConverter;
import com.agentforge.orchestrator.model.converter.PipelineConfigConverter;
import com.agentforge.orchestrator.model.converter.StageListConverter;
import com.agentforge.orchestrator.model.converter.StageMetricsConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One unit of work flowing through the stage pipeline.
 *
 * The enabled-stage list is fixed at creation. Status and the current-stage
 * pointer are changed only through {@code TaskStateMachine}, which enforces
 * {@link TaskStatus#canTransitionTo}.
 *
 * DB table: tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tasks")
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String title;

    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.PENDING;

    // Null until the first stage starts.
    @Enumerated(EnumType.STRING)
    @Column(name = "current_stage")
    private StageId currentStage;

    @Convert(converter = StageListConverter.class)
    @Column(name = "enabled_stages", nullable = false)
    private List<StageId> enabledStages = List.of();

    @Convert(converter = PipelineConfigConverter.class)
    @Column(name = "config", nullable = false)
    private PipelineConfig config = PipelineConfig.empty();

    // Outputs of finished stages, keyed "<stage>_output"; fed to later stages.
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "context", nullable = false)
    private Map<String, Object> context = new LinkedHashMap<>();

    @Convert(converter = StageMetricsConverter.class)
    @Column(name = "stage_metrics", nullable = false)
    private Map<StageId, StageMetrics> stageMetrics = new EnumMap<>(StageId.class);

    @Column(name = "total_tokens", nullable = false)
    private long totalTokens = 0;

    @Column(name = "total_cost", nullable = false)
    private double totalCost = 0.0;

    // Base priority for every queue item this task enqueues.
    @Column(nullable = false)
    private int priority = 5;

    @Column(name = "error_message")
    private String errorMessage;

    // Rework rounds (fix-needed results) plus stalled-worker redeliveries.
    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    // Fix-needed rework rounds only; bounds the fix loop.
    @Column(name = "rework_count", nullable = false)
    private int reworkCount = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Task() {}   // required by JPA

    public Task(String title, String description, List<StageId> enabledStages,
                PipelineConfig config, int priority) {
        this.title         = title;
        this.description   = description;
        this.enabledStages = List.copyOf(enabledStages);
        this.config        = config;
        this.priority      = priority;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID           getId()            { return id; }
    public String         getTitle()         { return title; }
    public String         getDescription()   { return description; }
    public TaskStatus     getStatus()        { return status; }
    public StageId        getCurrentStage()  { return currentStage; }
    public List<StageId>  getEnabledStages() { return enabledStages; }
    public PipelineConfig getConfig()        { return config; }
    public Map<String, Object> getContext()  { return context; }
    public Map<StageId, StageMetrics> getStageMetrics() { return stageMetrics; }
    public long           getTotalTokens()   { return totalTokens; }
    public double         getTotalCost()     { return totalCost; }
    public int            getPriority()      { return priority; }
    public String         getErrorMessage()  { return errorMessage; }
    public int            getRetryCount()    { return retryCount; }
    public int            getReworkCount()   { return reworkCount; }
    public Instant        getCreatedAt()     { return createdAt; }
    public Instant        getUpdatedAt()     { return updatedAt; }
    public Instant        getCompletedAt()   { return completedAt; }

    public void setStatus(TaskStatus status)          { this.status = status; }
    public void setCurrentStage(StageId stage)        { this.currentStage = stage; }
    public void setConfig(PipelineConfig config)      { this.config = config; }
    public void setErrorMessage(String errorMessage)  { this.errorMessage = errorMessage; }
    public void setCompletedAt(Instant t)             { this.completedAt = t; }
    public void incrementRetryCount()                 { this.retryCount++; }

    /** One more fix-needed round: counts as a retry and as a rework. */
    public void recordRework() {
        this.retryCount++;
        this.reworkCount++;
    }

    /** The stage a worker may run next: the current pointer, or the first enabled stage. */
    public StageId effectiveStage() {
        if (currentStage != null) return currentStage;
        return enabledStages.isEmpty() ? null : enabledStages.get(0);
    }

    /** The enabled stage after {@code stage}, or null if it is the last one. */
    public StageId stageAfter(StageId stage) {
        int idx = enabledStages.indexOf(stage);
        return (idx >= 0 && idx < enabledStages.size() - 1) ? enabledStages.get(idx + 1) : null;
    }

    /**
     * What a stage sees: the task's own fields plus every earlier stage's
     * output. Also used as the context snapshot of each queue item.
     */
    public Map<String, Object> snapshotContext() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("task_id", id == null ? null : id.toString());
        snapshot.put("title", title);
        if (description != null) snapshot.put("description", description);
        snapshot.putAll(context);
        return snapshot;
    }

    public void putContext(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(context);
        copy.put(key, value);
        this.context = copy;
    }

    public void addUsage(StageId stage, long tokens, double cost, long durationMs) {
        Map<StageId, StageMetrics> copy = new EnumMap<>(StageId.class);
        copy.putAll(stageMetrics);
        copy.put(stage, copy.getOrDefault(stage, StageMetrics.none()).plus(tokens, cost, durationMs));
        this.stageMetrics = copy;
        this.totalTokens += tokens;
        this.totalCost   += cost;
    }
}
