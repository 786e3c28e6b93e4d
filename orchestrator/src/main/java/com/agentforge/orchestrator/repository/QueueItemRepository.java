package com.agentforge.orchestrator.repository;

import com.agentforge.orchestrator.model.QueueItem;
import com.agentforge.orchestrator.model.QueueItemStatus;
import com.agentforge.orchestrator.model.StageId;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + scheduler queries for the queue_items table.
 */
public interface QueueItemRepository extends JpaRepository<QueueItem, UUID> {

    /**
     * Ids of the next claim candidates for a stage, best first:
     * highest priority, then earliest enqueue time.
     */
    @Query("""
            SELECT q.id FROM QueueItem q
            WHERE q.stage = :stage AND q.status = :status
            ORDER BY q.priority DESC, q.enqueuedAt ASC
            """)
    List<UUID> findCandidateIds(@Param("stage") StageId stage,
                                @Param("status") QueueItemStatus status,
                                Pageable page);

    /**
     * Claim one item: QUEUED → PROCESSING as a single conditional UPDATE.
     *
     * The WHERE clause re-checks status under the row lock, so when N workers
     * race for the same id exactly one UPDATE reports 1 row and the others 0.
     * Must run inside a transaction.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE QueueItem q
            SET q.status = :processing, q.workerId = :workerId,
                q.startedAt = :now, q.heartbeatAt = :now
            WHERE q.id = :id AND q.status = :queued
            """)
    int claim(@Param("id") UUID id,
              @Param("workerId") String workerId,
              @Param("now") Instant now,
              @Param("queued") QueueItemStatus queued,
              @Param("processing") QueueItemStatus processing);

    List<QueueItem> findByStageAndStatusInOrderByPriorityDescEnqueuedAtAsc(
            StageId stage, Collection<QueueItemStatus> statuses);

    /** QUEUED items old enough to age and still below the ceiling, all stages. */
    List<QueueItem> findByStatusAndEnqueuedAtLessThanEqualAndPriorityLessThan(
            QueueItemStatus status, Instant enqueuedBefore, int priorityCeiling);

    /** Same as above, scoped to one stage (runs right before a dequeue). */
    List<QueueItem> findByStageAndStatusAndEnqueuedAtLessThanEqualAndPriorityLessThan(
            StageId stage, QueueItemStatus status, Instant enqueuedBefore, int priorityCeiling);

    boolean existsByActiveKey(String activeKey);

    List<QueueItem> findByTaskIdOrderByEnqueuedAtAsc(UUID taskId);

    List<QueueItem> findByTaskIdAndStatus(UUID taskId, QueueItemStatus status);

    /** PROCESSING items whose worker has not heartbeated since {@code cutoff}. */
    List<QueueItem> findByStatusAndHeartbeatAtBefore(QueueItemStatus status, Instant cutoff);

    @Query("""
            SELECT new com.agentforge.orchestrator.repository.StageStatusCount(q.stage, q.status, COUNT(q))
            FROM QueueItem q
            WHERE q.status IN :statuses
            GROUP BY q.stage, q.status
            """)
    List<StageStatusCount> countByStageAndStatus(@Param("statuses") Collection<QueueItemStatus> statuses);
}
