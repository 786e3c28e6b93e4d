package com.agentforge.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * One call per stage run: system prompt plus a single user message in,
 * text and token usage out. Raw {@link HttpClient} keeps every header and
 * byte on the wire visible.
 */
@Component
public class ClaudeClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** role must be "user" or "assistant". */
    public record Message(String role, String content) {}

    /**
     * @param temperature null leaves the API default
     */
    public record CompletionRequest(String model, String system, List<Message> messages,
                                    int maxTokens, Double temperature) {}

    /** The assistant's text and what the call consumed. */
    public record Completion(String text, long inputTokens, long outputTokens) {
        public long totalTokens() { return inputTokens + outputTokens; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content, Usage usage) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Usage(@JsonProperty("input_tokens") long inputTokens,
                            @JsonProperty("output_tokens") long outputTokens) {}

        public String firstText() {
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER = "2023-06-01";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       apiUrl;

    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        @Value("${anthropic.api-url:https://api.anthropic.com/v1/messages}") String apiUrl,
                        ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.apiUrl = apiUrl;
        this.json   = objectMapper;
        this.http   = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send one request and return the assistant's text with its usage.
     *
     * @throws ClaudeApiException on a non-200 answer
     */
    public Completion complete(CompletionRequest req) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model",      req.model());
            body.put("max_tokens", req.maxTokens());
            body.put("system",     req.system());
            body.put("messages",   req.messages());
            if (req.temperature() != null) {
                body.put("temperature", req.temperature());
            }

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(Duration.ofSeconds(120))
                    .header("content-type",      "application/json")
                    .header("x-api-key",          apiKey)
                    .header("anthropic-version",  API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ClaudeApiException(response.statusCode(), response.body());
            }

            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            long in  = parsed.usage() == null ? 0 : parsed.usage().inputTokens();
            long out = parsed.usage() == null ? 0 : parsed.usage().outputTokens();
            log.debug("Claude call model={} input_tokens={} output_tokens={}", req.model(), in, out);
            return new Completion(parsed.firstText(), in, out);

        } catch (ClaudeApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Claude API call interrupted", e);
        } catch (Exception e) {
            throw new IllegalStateException("Claude API call failed: " + e.getMessage(), e);
        }
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeApiException extends RuntimeException {
        private final int statusCode;
        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
        }
        public int statusCode() { return statusCode; }
    }
}
