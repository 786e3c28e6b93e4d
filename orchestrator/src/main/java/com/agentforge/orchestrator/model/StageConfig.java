package com.agentforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed configuration of one stage inside a task's pipeline.
 *
 * {@code rejectionFeedback} is the only open-ended part: it carries the
 * structured critique from a rejected checkpoint (or a fix-needed result)
 * into the next execution of the same stage.
 *
 * @param enabled              whether the stage runs for this task
 * @param approvalRequired     suspend for a human decision after the stage succeeds
 * @param timeoutMinutes       approval timeout; null means {@link #DEFAULT_TIMEOUT_MINUTES}
 * @param autoApproveOnTimeout approve instead of failing the task when the timeout passes
 * @param model                model override for the stage agent (null = agent default)
 * @param temperature          sampling temperature override
 * @param maxTokens            completion budget override
 * @param instructions         free-text instructions appended to the stage prompt
 * @param rejectionFeedback    feedback merged in by rejections, empty when none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StageConfig(
        boolean enabled,
        boolean approvalRequired,
        Integer timeoutMinutes,
        boolean autoApproveOnTimeout,
        String  model,
        Double  temperature,
        Integer maxTokens,
        String  instructions,
        Map<String, Object> rejectionFeedback
) {

    public static final int DEFAULT_TIMEOUT_MINUTES = 60;

    public StageConfig {
        rejectionFeedback = rejectionFeedback == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(rejectionFeedback));
    }

    public static StageConfig enabledDefaults() {
        return new StageConfig(true, false, null, false, null, null, null, null, null);
    }

    public static StageConfig disabled() {
        return new StageConfig(false, false, null, false, null, null, null, null, null);
    }

    public static StageConfig withApproval(int timeoutMinutes, boolean autoApproveOnTimeout) {
        return new StageConfig(true, true, timeoutMinutes, autoApproveOnTimeout,
                null, null, null, null, null);
    }

    @JsonIgnore
    public int effectiveTimeoutMinutes() {
        return timeoutMinutes != null ? timeoutMinutes : DEFAULT_TIMEOUT_MINUTES;
    }

    @JsonIgnore
    public boolean hasRejectionFeedback() {
        return !rejectionFeedback.isEmpty();
    }

    /** Returns a copy whose feedback is the existing feedback overlaid with {@code feedback}. */
    public StageConfig withRejectionFeedback(Map<String, Object> feedback) {
        Map<String, Object> merged = new LinkedHashMap<>(rejectionFeedback);
        if (feedback != null) merged.putAll(feedback);
        return new StageConfig(enabled, approvalRequired, timeoutMinutes, autoApproveOnTimeout,
                model, temperature, maxTokens, instructions, merged);
    }

    /** Returns a copy with no rejection feedback. */
    public StageConfig withoutRejectionFeedback() {
        return new StageConfig(enabled, approvalRequired, timeoutMinutes, autoApproveOnTimeout,
                model, temperature, maxTokens, instructions, null);
    }
}
