package com.agentforge.orchestrator.agent;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Model defaults and pricing shared by every LLM-backed stage.
 * A stage's own {@code model} / {@code maxTokens} settings win over these.
 */
@Component
public class AgentSettings {

    private final String defaultModel;
    private final int    maxTokens;
    private final double inputCostPerMillion;
    private final double outputCostPerMillion;

    public AgentSettings(@Value("${agentforge.agent.default-model:claude-sonnet-4-6}") String defaultModel,
                         @Value("${agentforge.agent.max-tokens:8000}") int maxTokens,
                         @Value("${agentforge.agent.input-cost-per-million:3.0}") double inputCostPerMillion,
                         @Value("${agentforge.agent.output-cost-per-million:15.0}") double outputCostPerMillion) {
        this.defaultModel         = defaultModel;
        this.maxTokens            = maxTokens;
        this.inputCostPerMillion  = inputCostPerMillion;
        this.outputCostPerMillion = outputCostPerMillion;
    }

    public String defaultModel() { return defaultModel; }
    public int    maxTokens()    { return maxTokens; }

    /** Dollar cost of one call. */
    public double cost(long inputTokens, long outputTokens) {
        return (inputTokens * inputCostPerMillion + outputTokens * outputCostPerMillion) / 1_000_000.0;
    }
}
