package com.agentforge.orchestrator.api.dto;

import com.agentforge.orchestrator.model.QueueItem;
import com.agentforge.orchestrator.queue.StallRecovery;

import java.util.List;
import java.util.UUID;

/** Item ids handed back to their queue, and those that ran out of deliveries. */
public record StallRecoveryResponse(List<UUID> requeued, List<UUID> failed) {

    public static StallRecoveryResponse from(StallRecovery r) {
        return new StallRecoveryResponse(
                r.requeued().stream().map(QueueItem::getId).toList(),
                r.exhausted().stream().map(QueueItem::getId).toList());
    }
}
