package com.agentforge.orchestrator.model;

/**
 * Execution state of a QueueItem.
 *
 * Transitions:
 *   QUEUED     → PROCESSING (claimed by a worker)
 *   PROCESSING → DONE | FAILED
 *   PROCESSING → QUEUED (worker stopped heartbeating, redelivered)
 */
public enum QueueItemStatus {
    QUEUED,
    PROCESSING,
    DONE,
    FAILED;

    public boolean isActive() {
        return this == QUEUED || this == PROCESSING;
    }
}
