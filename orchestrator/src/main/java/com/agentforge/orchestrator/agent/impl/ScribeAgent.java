package com.agentforge.orchestrator.agent.impl;

import com.agentforge.orchestrator.agent.AgentSettings;
import com.agentforge.orchestrator.agent.LlmStageAgent;
import com.agentforge.orchestrator.agent.StagePrompts;
import com.agentforge.orchestrator.claude.ClaudeClient;
import com.agentforge.orchestrator.model.StageId;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Writes the feature document for the task. */
@Component
public class ScribeAgent extends LlmStageAgent {

    public ScribeAgent(ClaudeClient claude, StagePrompts prompts,
                       ObjectMapper objectMapper, AgentSettings settings) {
        super(claude, prompts, objectMapper, settings);
    }

    @Override
    public StageId stage() {
        return StageId.SCRIBE;
    }

    @Override
    protected String request(Map<String, Object> context) {
        return "Write the feature document for the task \"" + context.get("title") + "\".";
    }
}
