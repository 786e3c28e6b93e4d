package com.agentforge.orchestrator.agent;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ResponseParser. Static methods only, no context, no mocks.
 */
class ResponseParserTest {

    @Test
    void extractResult_withTag_returnsStrippedBody() {
        String response = """
                Read the plan, the change set looks complete.
                <result>
                  {"status": "success", "summary": "ok"}
                </result>
                """;
        Optional<String> result = ResponseParser.extractResult(response);
        assertThat(result).contains("{\"status\": \"success\", \"summary\": \"ok\"}");
    }

    @Test
    void extractResult_withJsonFenceInsideTag_unwrapsFence() {
        String response = """
                <result>
                ```json
                {"status": "fix_needed"}
                ```
                </result>
                """;
        assertThat(ResponseParser.extractResult(response)).contains("{\"status\": \"fix_needed\"}");
    }

    @Test
    void extractResult_withMultipleTags_returnsFirst() {
        String response = "<result>{\"n\":1}</result> trailing <result>{\"n\":2}</result>";
        assertThat(ResponseParser.extractResult(response)).contains("{\"n\":1}");
    }

    @Test
    void extractResult_withoutTag_returnsEmpty() {
        assertThat(ResponseParser.extractResult("Here is my answer: {\"status\":\"success\"}")).isEmpty();
    }

    @Test
    void extractResult_null_returnsEmpty() {
        assertThat(ResponseParser.extractResult(null)).isEmpty();
    }
}
