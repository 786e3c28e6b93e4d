package com.agentforge.orchestrator.agent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one stage run.
 *
 * FIX_NEEDED means the stage finished but judged its input unfit, e.g. a
 * review that found problems. The stage then runs again with
 * {@code outputSummary} as feedback.
 */
public record StageResult(
        Status              status,
        String              outputSummary,
        List<String>        artifacts,
        Map<String, Object> details,
        Usage               usage
) {

    public enum Status { SUCCESS, FIX_NEEDED }

    public record Usage(long tokens, double cost) {
        public static Usage none() { return new Usage(0, 0.0); }
    }

    public StageResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        details   = details == null ? Map.of() : new LinkedHashMap<>(details);
        usage     = usage == null ? Usage.none() : usage;
    }

    public static StageResult success(String summary, List<String> artifacts,
                                      Map<String, Object> details, Usage usage) {
        return new StageResult(Status.SUCCESS, summary, artifacts, details, usage);
    }

    public static StageResult fixNeeded(String summary, Map<String, Object> details, Usage usage) {
        return new StageResult(Status.FIX_NEEDED, summary, List.of(), details, usage);
    }

    public boolean isFixNeeded() {
        return status == Status.FIX_NEEDED;
    }

    /** What is stored in the task context under {@code <stage>_output}. */
    public Map<String, Object> toOutput() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", status.name().toLowerCase());
        out.put("summary", outputSummary);
        out.put("artifacts", artifacts);
        out.put("details", details);
        return out;
    }
}
