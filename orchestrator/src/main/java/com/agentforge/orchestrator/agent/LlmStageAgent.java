package com.agentforge.orchestrator.agent;

import com.agentforge.orchestrator.claude.ClaudeClient;
import com.agentforge.orchestrator.claude.ClaudeClient.Completion;
import com.agentforge.orchestrator.claude.ClaudeClient.CompletionRequest;
import com.agentforge.orchestrator.claude.ClaudeClient.Message;
import com.agentforge.orchestrator.error.StageExecutionException;
import com.agentforge.orchestrator.model.StageConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A stage backed by one model call.
 *
 * Builds the user message from the task context, the stage's instructions
 * and any rejection feedback, sends it with the stage's system prompt and
 * turns the {@code <result>} block of the reply into a {@link StageResult}.
 * Subclasses only name their stage and the request they make.
 */
public abstract class LlmStageAgent implements StageAgent {

    private static final Logger log = LoggerFactory.getLogger(LlmStageAgent.class);

    private static final TypeReference<Map<String, Object>> DETAILS_TYPE = new TypeReference<>() {};

    private final ClaudeClient  claude;
    private final StagePrompts  prompts;
    private final ObjectMapper  objectMapper;
    private final AgentSettings settings;

    protected LlmStageAgent(ClaudeClient claude, StagePrompts prompts,
                            ObjectMapper objectMapper, AgentSettings settings) {
        this.claude       = claude;
        this.prompts      = prompts;
        this.objectMapper = objectMapper;
        this.settings     = settings;
    }

    /** The stage-specific request placed after the context in the user message. */
    protected abstract String request(Map<String, Object> context);

    @Override
    public StageResult execute(StageConfig config, Map<String, Object> context) {
        String model  = config.model() != null ? config.model() : settings.defaultModel();
        int maxTokens = config.maxTokens() != null ? config.maxTokens() : settings.maxTokens();

        CompletionRequest req = new CompletionRequest(
                model,
                prompts.get(stage()),
                List.of(new Message("user", buildUserMessage(config, context))),
                maxTokens,
                config.temperature());

        Completion completion;
        try {
            completion = claude.complete(req);
        } catch (RuntimeException e) {
            throw new StageExecutionException(stage(), "model call failed: " + e.getMessage(), e);
        }

        StageResult.Usage usage = new StageResult.Usage(completion.totalTokens(),
                settings.cost(completion.inputTokens(), completion.outputTokens()));
        log.info("{} agent used {} tokens (model={})", stage().id(), completion.totalTokens(), model);
        return parse(completion.text(), usage);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    String buildUserMessage(StageConfig config, Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== TASK CONTEXT ===\n");
        sb.append(toJson(context)).append("\n");
        sb.append("=== END CONTEXT ===\n\n");

        if (config.instructions() != null && !config.instructions().isBlank()) {
            sb.append("ADDITIONAL INSTRUCTIONS:\n").append(config.instructions()).append("\n\n");
        }
        if (config.hasRejectionFeedback()) {
            sb.append("REVIEWER FEEDBACK:\n").append(toJson(config.rejectionFeedback())).append("\n\n");
        }
        sb.append(request(context));
        return sb.toString();
    }

    StageResult parse(String response, StageResult.Usage usage) {
        String body = ResponseParser.extractResult(response).orElseThrow(() ->
                new StageExecutionException(stage(), "response contained no <result> block"));

        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new StageExecutionException(stage(), "result block is not valid JSON", e);
        }

        String summary = node.path("summary").asText("");
        List<String> artifacts = new ArrayList<>();
        node.path("artifacts").forEach(a -> artifacts.add(a.asText()));
        Map<String, Object> details = node.path("details").isObject()
                ? objectMapper.convertValue(node.get("details"), DETAILS_TYPE)
                : Map.of();

        return "fix_needed".equalsIgnoreCase(node.path("status").asText())
                ? StageResult.fixNeeded(summary, details, usage)
                : StageResult.success(summary, artifacts, details, usage);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StageExecutionException(stage(), "context is not serialisable", e);
        }
    }
}
