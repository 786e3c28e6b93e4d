package com.agentforge.orchestrator.queue;

import com.agentforge.orchestrator.error.DuplicateActiveItemException;
import com.agentforge.orchestrator.error.InvalidStateException;
import com.agentforge.orchestrator.error.NotFoundException;
import com.agentforge.orchestrator.model.QueueItem;
import com.agentforge.orchestrator.model.QueueItemStatus;
import com.agentforge.orchestrator.model.StageId;
import com.agentforge.orchestrator.repository.QueueItemRepository;
import com.agentforge.orchestrator.repository.StageStatusCount;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable per-stage priority queues.
 *
 * Each stage has its own queue. Items are served by descending priority,
 * then by ascending enqueue time. Aging raises the priority of items that
 * have waited long enough, so a low-priority item cannot starve while new
 * high-priority work keeps arriving.
 *
 * All public methods that touch the DB are @Transactional. The database is
 * the only coordination point between workers: nothing here is cached.
 */
@Service
public class QueueService {

    private static final Logger log = LoggerFactory.getLogger(QueueService.class);

    /** +1 priority for every full interval an item has been waiting. */
    public static final Duration AGING_INTERVAL = Duration.ofMinutes(30);

    /** Deliveries of one item before a stalled worker fails it for good. */
    public static final int MAX_DELIVERIES = 3;

    // How many top candidates one claim round looks at.
    private static final int CLAIM_BATCH   = 8;
    private static final int CLAIM_ROUNDS  = 3;

    private static final EnumSet<QueueItemStatus> ACTIVE =
            EnumSet.of(QueueItemStatus.QUEUED, QueueItemStatus.PROCESSING);

    private final QueueItemRepository repo;
    private final Clock               clock;
    private final MeterRegistry       meterRegistry;
    private final Duration            stallTimeout;

    public QueueService(QueueItemRepository repo,
                        Clock clock,
                        MeterRegistry meterRegistry,
                        @Value("${agentforge.scheduler.stall-timeout:PT10M}") Duration stallTimeout) {
        this.repo          = repo;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
        this.stallTimeout  = stallTimeout;
    }

    // ------------------------------------------------------------------
    // Enqueue / dequeue
    // ------------------------------------------------------------------

    /**
     * Add a task to a stage's queue.
     *
     * @param priority clamped to [1, 10]
     * @param reason   free-form label for why the priority was chosen
     * @throws DuplicateActiveItemException if the task already has a QUEUED or
     *         PROCESSING item for this stage
     */
    @Transactional
    public QueueItem enqueue(UUID taskId, StageId stage, Map<String, Object> context,
                             int priority, String reason) {
        String key = QueueItem.activeKey(taskId, stage);
        if (repo.existsByActiveKey(key)) {
            throw new DuplicateActiveItemException(taskId, stage);
        }

        QueueItem item = new QueueItem(taskId, stage, context, priority, reason, clock.instant());
        try {
            item = repo.saveAndFlush(item);
        } catch (DataIntegrityViolationException e) {
            // Lost a race against a concurrent enqueue of the same (task, stage).
            throw new DuplicateActiveItemException(taskId, stage, e);
        }

        log.info("Enqueued task {} to {} queue with priority {} ({})",
                taskId, stage.id(), item.getPriority(), reason);
        return item;
    }

    public QueueItem enqueue(UUID taskId, StageId stage, Map<String, Object> context) {
        return enqueue(taskId, stage, context, QueueItem.DEFAULT_PRIORITY, "user_set");
    }

    @Transactional
    public Optional<QueueItem> dequeue(StageId stage, String workerId) {
        return dequeue(stage, workerId, clock.instant());
    }

    /**
     * Claim the best QUEUED item of a stage.
     *
     * Runs the stage-scoped aging pass first, then tries the top candidates
     * in order with a conditional UPDATE (QUEUED → PROCESSING). A candidate
     * another worker claimed first simply reports 0 rows and we move on, so
     * two workers can never both win the same item.
     *
     * @return the claimed item (status PROCESSING), or empty if the queue has
     *         nothing QUEUED
     */
    @Transactional
    public Optional<QueueItem> dequeue(StageId stage, String workerId, Instant now) {
        applyAging(stage, now);

        for (int round = 0; round < CLAIM_ROUNDS; round++) {
            List<UUID> candidates = repo.findCandidateIds(
                    stage, QueueItemStatus.QUEUED, PageRequest.of(0, CLAIM_BATCH));
            if (candidates.isEmpty()) {
                return Optional.empty();
            }
            for (UUID id : candidates) {
                int claimed = repo.claim(id, workerId, now,
                        QueueItemStatus.QUEUED, QueueItemStatus.PROCESSING);
                if (claimed == 1) {
                    QueueItem item = repo.findById(id).orElseThrow();
                    meterRegistry.counter("agentforge.queue.claims", "stage", stage.id()).increment();
                    log.info("Worker '{}' dequeued item {} (task {}) from {} queue, priority={}",
                            workerId, id, item.getTaskId(), stage.id(), item.getPriority());
                    return Optional.of(item);
                }
                log.debug("Item {} was claimed by another worker, trying next candidate", id);
            }
        }
        return Optional.empty();
    }

    // ------------------------------------------------------------------
    // Priority mutation (QUEUED items only)
    // ------------------------------------------------------------------

    /** Set an absolute priority (clamped to [1, 10]). */
    @Transactional
    public QueueItem setPriority(UUID itemId, int priority, String reason) {
        QueueItem item = queuedItem(itemId);
        int old = item.getPriority();
        item.setPriority(priority, reason);
        log.info("Set item {} priority: {} -> {} ({})", itemId, old, item.getPriority(), reason);
        return repo.save(item);
    }

    /** Raise priority by {@code delta} (at least 1), capped at the maximum. */
    @Transactional
    public QueueItem boostPriority(UUID itemId, int delta, String reason) {
        if (delta < 1) {
            throw new IllegalArgumentException("Boost delta must be at least 1, got " + delta);
        }
        QueueItem item = queuedItem(itemId);
        int old = item.getPriority();
        item.setPriority(old + delta, reason);
        log.info("Boosted item {} priority: {} -> {} ({})", itemId, old, item.getPriority(), reason);
        return repo.save(item);
    }

    /** Jump to the maximum priority so the item is served next. */
    @Transactional
    public QueueItem promoteToMax(UUID itemId) {
        return setPriority(itemId, QueueItem.MAX_PRIORITY, "promote");
    }

    // ------------------------------------------------------------------
    // Aging
    // ------------------------------------------------------------------

    /**
     * Aging sweep over every stage.
     *
     * An item that has waited {@code k} full intervals gets priority
     * {@code min(MAX, MIN + k)}, unless it is already higher. Priority is
     * never lowered.
     *
     * @return number of items whose priority changed
     */
    @Transactional
    public int applyAging(Instant now) {
        List<QueueItem> items = repo.findByStatusAndEnqueuedAtLessThanEqualAndPriorityLessThan(
                QueueItemStatus.QUEUED, now.minus(AGING_INTERVAL), QueueItem.MAX_PRIORITY);
        int updated = age(items, now);
        if (updated > 0) {
            log.info("Aging pass: updated {} queue items", updated);
        }
        return updated;
    }

    @Transactional
    public int applyAging() {
        return applyAging(clock.instant());
    }

    /** Aging scoped to one stage; runs right before each dequeue. */
    @Transactional
    public int applyAging(StageId stage, Instant now) {
        List<QueueItem> items = repo.findByStageAndStatusAndEnqueuedAtLessThanEqualAndPriorityLessThan(
                stage, QueueItemStatus.QUEUED, now.minus(AGING_INTERVAL), QueueItem.MAX_PRIORITY);
        return age(items, now);
    }

    /** Priority an item deserves purely from its wait time. */
    public static int agedPriority(Instant enqueuedAt, Instant now) {
        long intervals = Duration.between(enqueuedAt, now).toMinutes() / AGING_INTERVAL.toMinutes();
        return (int) Math.min(QueueItem.MAX_PRIORITY, QueueItem.MIN_PRIORITY + Math.max(0, intervals));
    }

    private int age(List<QueueItem> items, Instant now) {
        int updated = 0;
        for (QueueItem item : items) {
            int target = agedPriority(item.getEnqueuedAt(), now);
            if (target > item.getPriority()) {
                item.setPriority(target, "aging");
                updated++;
            }
        }
        if (updated > 0) {
            repo.saveAll(items);
        }
        return updated;
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    @Transactional
    public QueueItem markDone(UUID itemId) {
        QueueItem item = processingItem(itemId);
        item.markDone(clock.instant());
        log.info("Item {} ({} queue, task {}) DONE", itemId, item.getStage().id(), item.getTaskId());
        return repo.save(item);
    }

    @Transactional
    public QueueItem markFailed(UUID itemId, String error) {
        QueueItem item = processingItem(itemId);
        item.markFailed(error, clock.instant());
        log.warn("Item {} ({} queue, task {}) FAILED: {}",
                itemId, item.getStage().id(), item.getTaskId(), error);
        return repo.save(item);
    }

    /** Prove the worker running this item is alive. No-op once the item is finished. */
    @Transactional
    public void heartbeat(UUID itemId) {
        repo.findById(itemId)
                .filter(item -> item.getStatus() == QueueItemStatus.PROCESSING)
                .ifPresent(item -> {
                    item.setHeartbeatAt(clock.instant());
                    repo.save(item);
                });
    }

    /**
     * Detect items whose worker silently died.
     *
     * A PROCESSING item without a heartbeat for longer than the stall timeout
     * goes back to QUEUED (at-least-once redelivery). After
     * {@link #MAX_DELIVERIES} deliveries it is FAILED instead.
     */
    @Transactional
    public StallRecovery recoverStalled(Instant now) {
        List<QueueItem> stalled = repo.findByStatusAndHeartbeatAtBefore(
                QueueItemStatus.PROCESSING, now.minus(stallTimeout));
        List<QueueItem> requeued  = new ArrayList<>();
        List<QueueItem> exhausted = new ArrayList<>();

        for (QueueItem item : stalled) {
            log.warn("Recovering stalled item {} (worker={}, last heartbeat={})",
                    item.getId(), item.getWorkerId(), item.getHeartbeatAt());
            if (item.getRetryCount() + 1 >= MAX_DELIVERIES) {
                item.markFailed("Worker heartbeat timed out after " + MAX_DELIVERIES + " deliveries", now);
                exhausted.add(item);
            } else {
                item.requeue("Worker heartbeat timed out after " + stallTimeout.toMinutes() + " minutes");
                requeued.add(item);
            }
        }
        repo.saveAll(stalled);
        return new StallRecovery(requeued, exhausted);
    }

    /** Fail every QUEUED item of a task so no worker claims it later. */
    @Transactional
    public int cancelQueued(UUID taskId, String reason) {
        List<QueueItem> queued = repo.findByTaskIdAndStatus(taskId, QueueItemStatus.QUEUED);
        Instant now = clock.instant();
        queued.forEach(item -> item.markFailed(reason, now));
        repo.saveAll(queued);
        if (!queued.isEmpty()) {
            log.info("Withdrew {} queued item(s) of task {}: {}", queued.size(), taskId, reason);
        }
        return queued.size();
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** A stage's queue in service order. */
    @Transactional(readOnly = true)
    public List<QueueItem> getQueue(StageId stage, boolean includeProcessing) {
        EnumSet<QueueItemStatus> statuses = includeProcessing
                ? EnumSet.copyOf(ACTIVE)
                : EnumSet.of(QueueItemStatus.QUEUED);
        return repo.findByStageAndStatusInOrderByPriorityDescEnqueuedAtAsc(stage, statuses);
    }

    /** Queued / processing counts for every stage, including empty ones. */
    @Transactional(readOnly = true)
    public Map<StageId, QueueCounts> summary() {
        Map<StageId, QueueCounts> summary = new EnumMap<>(StageId.class);
        for (StageId stage : StageId.values()) {
            summary.put(stage, QueueCounts.zero());
        }
        for (StageStatusCount row : repo.countByStageAndStatus(ACTIVE)) {
            QueueCounts c = summary.get(row.stage());
            summary.put(row.stage(), row.status() == QueueItemStatus.QUEUED
                    ? new QueueCounts(row.count(), c.processing())
                    : new QueueCounts(c.queued(), row.count()));
        }
        return summary;
    }

    @Transactional(readOnly = true)
    public List<QueueItem> itemsForTask(UUID taskId) {
        return repo.findByTaskIdOrderByEnqueuedAtAsc(taskId);
    }

    @Transactional(readOnly = true)
    public QueueItem get(UUID itemId) {
        return repo.findById(itemId).orElseThrow(() -> NotFoundException.of("Queue item", itemId));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private QueueItem queuedItem(UUID itemId) {
        QueueItem item = get(itemId);
        if (item.getStatus() != QueueItemStatus.QUEUED) {
            throw new NotFoundException("Queue item " + itemId + " is not queued (status="
                    + item.getStatus() + ")");
        }
        return item;
    }

    private QueueItem processingItem(UUID itemId) {
        QueueItem item = get(itemId);
        if (item.getStatus() != QueueItemStatus.PROCESSING) {
            throw new InvalidStateException("Queue item " + itemId + " is not processing (status="
                    + item.getStatus() + ")");
        }
        return item;
    }
}
