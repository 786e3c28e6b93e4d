package com.agentforge.orchestrator.agent.impl;

import com.agentforge.orchestrator.agent.AgentSettings;
import com.agentforge.orchestrator.agent.LlmStageAgent;
import com.agentforge.orchestrator.agent.StagePrompts;
import com.agentforge.orchestrator.claude.ClaudeClient;
import com.agentforge.orchestrator.model.StageId;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reviews the changes. A review that finds problems answers
 * {@code fix_needed}, which sends the stage round again with the findings.
 */
@Component
public class SentinelAgent extends LlmStageAgent {

    public SentinelAgent(ClaudeClient claude, StagePrompts prompts,
                         ObjectMapper objectMapper, AgentSettings settings) {
        super(claude, prompts, objectMapper, settings);
    }

    @Override
    public StageId stage() {
        return StageId.SENTINEL;
    }

    @Override
    protected String request(Map<String, Object> context) {
        return "Review the changes in forge_output. Answer \"success\" only if they can be "
                + "released as they are; otherwise answer \"fix_needed\" with the fixes required.";
    }
}
