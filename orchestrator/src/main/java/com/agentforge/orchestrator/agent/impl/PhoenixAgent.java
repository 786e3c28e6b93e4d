package com.agentforge.orchestrator.agent.impl;

import com.agentforge.orchestrator.agent.AgentSettings;
import com.agentforge.orchestrator.agent.LlmStageAgent;
import com.agentforge.orchestrator.agent.StagePrompts;
import com.agentforge.orchestrator.claude.ClaudeClient;
import com.agentforge.orchestrator.model.StageId;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Prepares release notes and the rollout checklist. */
@Component
public class PhoenixAgent extends LlmStageAgent {

    public PhoenixAgent(ClaudeClient claude, StagePrompts prompts,
                        ObjectMapper objectMapper, AgentSettings settings) {
        super(claude, prompts, objectMapper, settings);
    }

    @Override
    public StageId stage() {
        return StageId.PHOENIX;
    }

    @Override
    protected String request(Map<String, Object> context) {
        return "Prepare the release notes and rollout checklist for the reviewed changes.";
    }
}
