package com.agentforge.orchestrator.model;

/**
 * Usage accumulated by one stage of a task across all of its runs
 * (a stage runs more than once after a rejection).
 */
public record StageMetrics(int runs, long tokens, double cost, long durationMs) {

    public static StageMetrics none() {
        return new StageMetrics(0, 0, 0.0, 0);
    }

    public StageMetrics plus(long tokens, double cost, long durationMs) {
        return new StageMetrics(runs + 1, this.tokens + tokens, this.cost + cost,
                this.durationMs + durationMs);
    }
}
