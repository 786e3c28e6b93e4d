package com.agentforge.orchestrator.event;

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
import java.util.Map;

/**
 * Best-effort POST of task status events to one configured URL.
 *
 * Disabled when {@code agentforge.notify.webhook-url} is blank. Delivery
 * failures are logged at WARN and never reach the caller: a task's state is
 * already committed by the time it is announced.
 */
@Component
public class WebhookNotifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       url;

    public WebhookNotifier(@Value("${agentforge.notify.webhook-url:}") String url,
                           ObjectMapper objectMapper) {
        this.url  = url;
        this.json = objectMapper;
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    public boolean isEnabled() {
        return url != null && !url.isBlank();
    }

    public void send(TaskStatusEvent event) {
        if (!isEnabled()) return;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event",       "task.status_changed");
        payload.put("task_id",     event.taskId());
        payload.put("status",      event.status());
        payload.put("stage",       event.stage() == null ? null : event.stage().id());
        payload.put("message",     event.message());
        payload.put("occurred_at", event.occurredAt());

        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(10))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(payload)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                log.warn("Webhook for task {} answered HTTP {}: {}",
                        event.taskId(), resp.statusCode(), resp.body());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Webhook for task {} interrupted", event.taskId());
        } catch (Exception e) {
            log.warn("Webhook for task {} failed: {}", event.taskId(), e.getMessage());
        }
    }
}
