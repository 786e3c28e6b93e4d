package com.agentforge.orchestrator.agent.impl;

import com.agentforge.orchestrator.agent.AgentSettings;
import com.agentforge.orchestrator.agent.LlmStageAgent;
import com.agentforge.orchestrator.agent.StagePrompts;
import com.agentforge.orchestrator.claude.ClaudeClient;
import com.agentforge.orchestrator.model.StageId;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Turns the feature document into an implementation plan. */
@Component
public class ArchitectAgent extends LlmStageAgent {

    public ArchitectAgent(ClaudeClient claude, StagePrompts prompts,
                          ObjectMapper objectMapper, AgentSettings settings) {
        super(claude, prompts, objectMapper, settings);
    }

    @Override
    public StageId stage() {
        return StageId.ARCHITECT;
    }

    @Override
    protected String request(Map<String, Object> context) {
        return context.containsKey(StageId.SCRIBE.outputKey())
                ? "Write the implementation plan for the feature document in scribe_output."
                : "Write the implementation plan for the task described above.";
    }
}
