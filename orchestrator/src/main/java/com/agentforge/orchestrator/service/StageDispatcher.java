package com.agentforge.orchestrator.service;

import com.agentforge.orchestrator.approval.ApprovalService;
import com.agentforge.orchestrator.model.QueueItem;
import com.agentforge.orchestrator.model.StageId;
import com.agentforge.orchestrator.queue.QueueService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Background loop that drives the stage queues.
 *
 * Every poll it walks the stages in pipeline order and, while a worker is
 * free, claims one QUEUED item and hands it to the fixed worker pool. The
 * database is the queue: several orchestrator instances can run this loop
 * against the same tables, the conditional claim keeps them apart.
 *
 * It also runs the periodic sweeps: approval timeouts, stalled-worker
 * recovery, queue aging and the heartbeat of items running here.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "agentforge.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class StageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StageDispatcher.class);

    private final ExecutorService workers;
    private final Semaphore       permits;
    private final String          instanceId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

    // Items currently running on this instance; heartbeated until they finish.
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    private final QueueService    queueService;
    private final StageExecutor   executor;
    private final ApprovalService approvalService;
    private final TaskService     taskService;

    public StageDispatcher(QueueService queueService,
                           StageExecutor executor,
                           ApprovalService approvalService,
                           TaskService taskService,
                           @Value("${agentforge.scheduler.worker-count:4}") int workerCount) {
        this.queueService    = queueService;
        this.executor        = executor;
        this.approvalService = approvalService;
        this.taskService     = taskService;
        this.workers         = Executors.newFixedThreadPool(workerCount);
        this.permits         = new Semaphore(workerCount);
        log.info("Stage dispatcher {} started with {} workers", instanceId, workerCount);
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    /**
     * Tick: fill free workers with claimed items, earliest stage first.
     *
     * fixedDelay waits after the previous tick finishes, so an idle system
     * polls the database at most once per delay.
     */
    @Scheduled(fixedDelayString = "${agentforge.scheduler.poll-delay-ms:2000}")
    public void tick() {
        for (StageId stage : StageId.ORDERED) {
            while (permits.tryAcquire()) {
                Optional<QueueItem> claimed;
                try {
                    claimed = queueService.dequeue(stage, instanceId);
                } catch (RuntimeException e) {
                    permits.release();
                    throw e;
                }
                if (claimed.isEmpty()) {
                    permits.release();
                    break;
                }
                submit(claimed.get());
            }
        }
    }

    private void submit(QueueItem item) {
        inFlight.add(item.getId());
        workers.submit(() -> {
            try {
                executor.execute(item);
            } catch (Exception e) {
                log.error("Unhandled error running item {} (task {}, stage {}): {}",
                        item.getId(), item.getTaskId(), item.getStage().id(), e.getMessage(), e);
                executor.abandon(item, e);
            } finally {
                inFlight.remove(item.getId());
                permits.release();
            }
        });
    }

    // ------------------------------------------------------------------
    // Sweeps
    // ------------------------------------------------------------------

    @Scheduled(fixedDelayString = "${agentforge.scheduler.heartbeat-ms:60000}")
    public void heartbeat() {
        inFlight.forEach(queueService::heartbeat);
    }

    @Scheduled(fixedDelayString = "${agentforge.scheduler.timeout-sweep-ms:60000}")
    public void checkApprovalTimeouts() {
        int resolved = approvalService.checkTimeouts().size();
        if (resolved > 0) {
            log.info("Timeout sweep resolved {} approval request(s)", resolved);
        }
    }

    @Scheduled(fixedDelayString = "${agentforge.scheduler.stall-sweep-ms:60000}")
    public void recoverStalled() {
        taskService.recoverStalledItems();
    }

    @Scheduled(fixedDelayString = "${agentforge.scheduler.aging-sweep-ms:300000}")
    public void applyAging() {
        queueService.applyAging();
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        workers.shutdown();
        if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("Workers still busy after 30 s; {} item(s) left to stall recovery", inFlight.size());
            workers.shutdownNow();
        }
    }
}
