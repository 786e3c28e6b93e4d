package com.agentforge.orchestrator.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Fans committed task status changes out to the log and the webhook.
 *
 * AFTER_COMMIT: a transition that rolls back is never announced.
 * {@code fallbackExecution} covers events published outside a transaction.
 */
@Component
public class TaskNotificationListener {

    private static final Logger log = LoggerFactory.getLogger(TaskNotificationListener.class);

    private final WebhookNotifier webhook;

    public TaskNotificationListener(WebhookNotifier webhook) {
        this.webhook = webhook;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onStatusChange(TaskStatusEvent event) {
        log.info("Task {} is now {} (stage={}): {}", event.taskId(), event.status(),
                event.stage() == null ? "-" : event.stage().id(), event.message());
        webhook.send(event);
    }
}
