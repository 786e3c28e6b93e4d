package com.agentforge.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a pipeline Task.
 *
 * Transitions:
 *   PENDING    → PROCESSING | FAILED | CANCELLED
 *   PROCESSING → PROCESSING (next stage) | AWAITING_REVIEW | AWAITING_RELEASE
 *                | COMPLETED | FAILED | CANCELLED
 *   AWAITING_* → PROCESSING (approved / rejected) | FAILED (timeout) | CANCELLED
 *
 * COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum TaskStatus {
    PENDING,
    PROCESSING,
    AWAITING_REVIEW,
    AWAITING_RELEASE,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isAwaiting() {
        return this == AWAITING_REVIEW || this == AWAITING_RELEASE;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return allowedTargets().contains(next);
    }

    private Set<TaskStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROCESSING, FAILED, CANCELLED);
            case PROCESSING -> EnumSet.of(PROCESSING, AWAITING_REVIEW, AWAITING_RELEASE,
                                          COMPLETED, FAILED, CANCELLED);
            case AWAITING_REVIEW, AWAITING_RELEASE -> EnumSet.of(PROCESSING, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }
}
