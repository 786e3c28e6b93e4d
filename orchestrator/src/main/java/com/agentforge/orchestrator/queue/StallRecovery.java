package com.agentforge.orchestrator.queue;

import com.agentforge.orchestrator.model.QueueItem;

import java.util.List;

/**
 * Outcome of one stalled-item sweep.
 *
 * @param requeued  items handed back to their queue for another delivery
 * @param exhausted items that used up their deliveries and are now FAILED;
 *                  their tasks must be failed by the caller
 */
public record StallRecovery(List<QueueItem> requeued, List<QueueItem> exhausted) {

    public boolean isEmpty() {
        return requeued.isEmpty() && exhausted.isEmpty();
    }
}
