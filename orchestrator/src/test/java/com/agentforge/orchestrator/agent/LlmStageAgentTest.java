package com.agentforge.orchestrator.agent;

import com.agentforge.orchestrator.agent.impl.SentinelAgent;
import com.agentforge.orchestrator.claude.ClaudeClient;
import com.agentforge.orchestrator.claude.ClaudeClient.Completion;
import com.agentforge.orchestrator.claude.ClaudeClient.CompletionRequest;
import com.agentforge.orchestrator.error.StageExecutionException;
import com.agentforge.orchestrator.model.StageConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests the shared model-call path through a concrete stage agent.
 * ClaudeClient is mocked; prompts, settings and JSON handling are real.
 */
@ExtendWith(MockitoExtension.class)
class LlmStageAgentTest {

    @Mock ClaudeClient claude;

    LlmStageAgent agent;

    @BeforeEach
    void setUp() {
        AgentSettings settings = new AgentSettings("default-model", 4000, 3.0, 15.0);
        agent = new SentinelAgent(claude, new StagePrompts(), new ObjectMapper(), settings);
    }

    // ------------------------------------------------------------------
    // execute()
    // ------------------------------------------------------------------

    @Test
    void execute_success_parsesResultAndComputesUsage() {
        when(claude.complete(any())).thenReturn(new Completion("""
                Looks good.
                <result>{"status":"success","summary":"approved","artifacts":["review.md"],
                         "details":{"issues":0}}</result>
                """, 1_000_000, 100_000));

        StageResult result = agent.execute(StageConfig.enabledDefaults(), Map.of("title", "CSV export"));

        assertThat(result.isFixNeeded()).isFalse();
        assertThat(result.outputSummary()).isEqualTo("approved");
        assertThat(result.artifacts()).containsExactly("review.md");
        assertThat(result.details()).containsEntry("issues", 0);
        assertThat(result.usage().tokens()).isEqualTo(1_100_000);
        assertThat(result.usage().cost()).isEqualTo(4.5);
    }

    @Test
    void execute_fixNeeded_returnsFixNeededResult() {
        when(claude.complete(any())).thenReturn(new Completion(
                "<result>{\"status\":\"fix_needed\",\"summary\":\"add tests\"}</result>", 10, 10));

        StageResult result = agent.execute(StageConfig.enabledDefaults(), Map.of());

        assertThat(result.isFixNeeded()).isTrue();
        assertThat(result.outputSummary()).isEqualTo("add tests");
        assertThat(result.toOutput()).containsEntry("status", "fix_needed");
    }

    @Test
    void execute_stageOverrides_winOverDefaults() {
        when(claude.complete(any())).thenReturn(new Completion(
                "<result>{\"status\":\"success\",\"summary\":\"ok\"}</result>", 1, 1));
        StageConfig config = new StageConfig(true, false, null, false,
                "review-model", 0.2, 1200, null, null);

        agent.execute(config, Map.of());

        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(claude).complete(captor.capture());
        assertThat(captor.getValue().model()).isEqualTo("review-model");
        assertThat(captor.getValue().maxTokens()).isEqualTo(1200);
        assertThat(captor.getValue().temperature()).isEqualTo(0.2);
        assertThat(captor.getValue().system()).contains("SENTINEL").contains("<result>");
    }

    @Test
    void execute_modelCallFails_wrapsInStageExecutionException() {
        when(claude.complete(any())).thenThrow(new ClaudeClient.ClaudeApiException(529, "overloaded"));

        assertThatThrownBy(() -> agent.execute(StageConfig.enabledDefaults(), Map.of()))
                .isInstanceOf(StageExecutionException.class)
                .hasMessageContaining("model call failed");
    }

    // ------------------------------------------------------------------
    // parse() / buildUserMessage()
    // ------------------------------------------------------------------

    @Test
    void parse_withoutResultBlock_throws() {
        assertThatThrownBy(() -> agent.parse("I forgot the tag", StageResult.Usage.none()))
                .isInstanceOf(StageExecutionException.class)
                .hasMessageContaining("no <result> block");
    }

    @Test
    void parse_invalidJson_throws() {
        assertThatThrownBy(() -> agent.parse("<result>{not json</result>", StageResult.Usage.none()))
                .isInstanceOf(StageExecutionException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void buildUserMessage_includesContextInstructionsAndFeedback() {
        Map<String, Object> feedback = new LinkedHashMap<>();
        feedback.put("comment", "check the null handling");
        StageConfig config = new StageConfig(true, false, null, false,
                null, null, null, "Focus on security", feedback);

        String message = agent.buildUserMessage(config, Map.of("forge_output", "diff"));

        assertThat(message)
                .contains("=== TASK CONTEXT ===")
                .contains("forge_output")
                .contains("ADDITIONAL INSTRUCTIONS:\nFocus on security")
                .contains("REVIEWER FEEDBACK:")
                .contains("check the null handling");
    }

    @Test
    void buildUserMessage_withoutFeedback_omitsFeedbackSection() {
        String message = agent.buildUserMessage(StageConfig.enabledDefaults(), Map.of());
        assertThat(message).doesNotContain("REVIEWER FEEDBACK:").doesNotContain("ADDITIONAL INSTRUCTIONS");
    }
}
