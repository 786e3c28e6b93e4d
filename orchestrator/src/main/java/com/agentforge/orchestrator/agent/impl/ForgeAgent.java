package com.agentforge.orchestrator.agent.impl;

import com.agentforge.orchestrator.agent.AgentSettings;
import com.agentforge.orchestrator.agent.LlmStageAgent;
import com.agentforge.orchestrator.agent.StagePrompts;
import com.agentforge.orchestrator.claude.ClaudeClient;
import com.agentforge.orchestrator.model.StageId;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Produces the code changes for the plan as unified diffs. */
@Component
public class ForgeAgent extends LlmStageAgent {

    public ForgeAgent(ClaudeClient claude, StagePrompts prompts,
                      ObjectMapper objectMapper, AgentSettings settings) {
        super(claude, prompts, objectMapper, settings);
    }

    @Override
    public StageId stage() {
        return StageId.FORGE;
    }

    @Override
    protected String request(Map<String, Object> context) {
        return "Implement the plan in architect_output and describe the changes as unified diffs.";
    }
}
