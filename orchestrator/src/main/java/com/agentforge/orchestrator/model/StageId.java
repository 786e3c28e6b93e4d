package com.agentforge.orchestrator.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The five pipeline stages, declared in their fixed execution order.
 *
 * Each stage owns one queue and one checkpoint. The checkpoint id names the
 * stage output a human reviews when the stage is configured with
 * {@code approvalRequired}.
 */
public enum StageId {
    SCRIBE   ("scribe",    "scribe_output",   1),   // Feature documentation
    ARCHITECT("architect", "architect_plan",  2),   // Implementation plan
    FORGE    ("forge",     "forge_code",      3),   // Code changes
    SENTINEL ("sentinel",  "sentinel_review", 4),   // Review of the changes
    PHOENIX  ("phoenix",   "phoenix_release", 5);   // Release notes and hand-off

    /** All stages in execution order. */
    public static final List<StageId> ORDERED = List.of(values());

    private final String id;
    private final String checkpoint;
    private final int    approvalPriority;

    StageId(String id, String checkpoint, int approvalPriority) {
        this.id               = id;
        this.checkpoint       = checkpoint;
        this.approvalPriority = approvalPriority;
    }

    public String id()               { return id; }
    public String checkpoint()       { return checkpoint; }

    /** Dashboard ordering weight of this stage's checkpoint (higher = shown first). */
    public int approvalPriority()    { return approvalPriority; }

    /** Key under which this stage's output is stored in the task context. */
    public String outputKey()        { return id + "_output"; }

    /** Case-insensitive lookup by lowercase id or enum name. */
    public static Optional<StageId> fromId(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.id.equals(v))
                .findFirst();
    }

    public static Optional<StageId> fromCheckpoint(String checkpoint) {
        return Arrays.stream(values())
                .filter(s -> s.checkpoint.equalsIgnoreCase(checkpoint))
                .findFirst();
    }
}
