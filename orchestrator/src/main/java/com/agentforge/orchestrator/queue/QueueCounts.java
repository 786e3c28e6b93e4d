package com.agentforge.orchestrator.queue;

/** Number of QUEUED and PROCESSING items in one stage's queue. */
public record QueueCounts(long queued, long processing) {

    public static QueueCounts zero() {
        return new QueueCounts(0, 0);
    }
}
