package com.agentforge.orchestrator.queue;

import com.agentforge.orchestrator.error.DuplicateActiveItemException;
import com.agentforge.orchestrator.error.InvalidStateException;
import com.agentforge.orchestrator.error.NotFoundException;
import com.agentforge.orchestrator.model.QueueItem;
import com.agentforge.orchestrator.model.QueueItemStatus;
import com.agentforge.orchestrator.model.StageId;
import com.agentforge.orchestrator.repository.QueueItemRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for QueueService rules that do not need a database:
 * aging arithmetic, priority bounds, duplicate detection and stall recovery.
 */
@ExtendWith(MockitoExtension.class)
class QueueServiceTest {

    static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock QueueItemRepository repo;

    QueueService service;

    @BeforeEach
    void setUp() {
        service = new QueueService(repo, Clock.fixed(NOW, ZoneOffset.UTC),
                new SimpleMeterRegistry(), Duration.ofMinutes(10));
    }

    // ------------------------------------------------------------------
    // agedPriority()
    // ------------------------------------------------------------------

    @Test
    void agedPriority_growsOnePerFullInterval() {
        assertThat(QueueService.agedPriority(NOW.minus(Duration.ofMinutes(29)), NOW)).isEqualTo(1);
        assertThat(QueueService.agedPriority(NOW.minus(Duration.ofMinutes(30)), NOW)).isEqualTo(2);
        assertThat(QueueService.agedPriority(NOW.minus(Duration.ofMinutes(95)), NOW)).isEqualTo(4);
    }

    @Test
    void agedPriority_isCappedAtMax() {
        assertThat(QueueService.agedPriority(NOW.minus(Duration.ofDays(2)), NOW))
                .isEqualTo(QueueItem.MAX_PRIORITY);
    }

    @Test
    void applyAging_raisesOnlyItemsBelowTheirAgedPriority() {
        QueueItem low  = item(2, NOW.minus(Duration.ofMinutes(95)));
        QueueItem high = item(8, NOW.minus(Duration.ofMinutes(95)));
        when(repo.findByStatusAndEnqueuedAtLessThanEqualAndPriorityLessThan(
                QueueItemStatus.QUEUED, NOW.minus(QueueService.AGING_INTERVAL), QueueItem.MAX_PRIORITY))
                .thenReturn(List.of(low, high));

        int updated = service.applyAging(NOW);

        assertThat(updated).isEqualTo(1);
        assertThat(low.getPriority()).isEqualTo(4);
        assertThat(low.getPriorityReason()).isEqualTo("aging");
        assertThat(high.getPriority()).isEqualTo(8);
    }

    // ------------------------------------------------------------------
    // enqueue()
    // ------------------------------------------------------------------

    @Test
    void enqueue_clampsPriority() {
        when(repo.existsByActiveKey(anyString())).thenReturn(false);
        when(repo.saveAndFlush(any())).thenAnswer(inv -> inv.getArgument(0));

        QueueItem item = service.enqueue(UUID.randomUUID(), StageId.SCRIBE, Map.of(), 42, "user_set");

        assertThat(item.getPriority()).isEqualTo(QueueItem.MAX_PRIORITY);
        assertThat(item.getEnqueuedAt()).isEqualTo(NOW);
        assertThat(item.getStatus()).isEqualTo(QueueItemStatus.QUEUED);
    }

    @Test
    void enqueue_activeItemExists_throwsDuplicate() {
        when(repo.existsByActiveKey(anyString())).thenReturn(true);

        assertThatThrownBy(() -> service.enqueue(UUID.randomUUID(), StageId.FORGE, Map.of()))
                .isInstanceOf(DuplicateActiveItemException.class);
        verify(repo, never()).saveAndFlush(any());
    }

    @Test
    void enqueue_lostRaceOnUniqueKey_throwsDuplicate() {
        when(repo.existsByActiveKey(anyString())).thenReturn(false);
        when(repo.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("active_key"));

        assertThatThrownBy(() -> service.enqueue(UUID.randomUUID(), StageId.FORGE, Map.of()))
                .isInstanceOf(DuplicateActiveItemException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
    }

    // ------------------------------------------------------------------
    // Priority mutation
    // ------------------------------------------------------------------

    @Test
    void boostPriority_deltaBelowOne_isRejected() {
        assertThatThrownBy(() -> service.boostPriority(UUID.randomUUID(), 0, "manual_boost"))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(repo);
    }

    @Test
    void boostPriority_capsAtMax() {
        UUID id = UUID.randomUUID();
        QueueItem item = item(9, NOW);
        when(repo.findById(id)).thenReturn(Optional.of(item));
        when(repo.save(item)).thenReturn(item);

        service.boostPriority(id, 5, "manual_boost");

        assertThat(item.getPriority()).isEqualTo(10);
        assertThat(item.getPriorityReason()).isEqualTo("manual_boost");
    }

    @Test
    void setPriority_itemNotQueued_throwsNotFound() {
        UUID id = UUID.randomUUID();
        QueueItem item = item(5, NOW);
        claimed(item, "worker-1");
        when(repo.findById(id)).thenReturn(Optional.of(item));

        assertThatThrownBy(() -> service.setPriority(id, 7, "user_set"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("not queued");
    }

    @Test
    void promoteToMax_unknownItem_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(repo.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.promoteToMax(id)).isInstanceOf(NotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    @Test
    void markDone_releasesActiveKey() {
        UUID id = UUID.randomUUID();
        QueueItem item = item(5, NOW);
        claimed(item, "worker-1");
        when(repo.findById(id)).thenReturn(Optional.of(item));
        when(repo.save(item)).thenReturn(item);

        service.markDone(id);

        assertThat(item.getStatus()).isEqualTo(QueueItemStatus.DONE);
        assertThat(item.getActiveKey()).isNull();
        assertThat(item.getCompletedAt()).isEqualTo(NOW);
    }

    @Test
    void markFailed_itemStillQueued_throwsInvalidState() {
        UUID id = UUID.randomUUID();
        when(repo.findById(id)).thenReturn(Optional.of(item(5, NOW)));

        assertThatThrownBy(() -> service.markFailed(id, "boom")).isInstanceOf(InvalidStateException.class);
    }

    // ------------------------------------------------------------------
    // recoverStalled()
    // ------------------------------------------------------------------

    @Test
    void recoverStalled_requeuesUntilDeliveriesRunOut() {
        QueueItem fresh = stalled(0);
        QueueItem lastTry = stalled(QueueService.MAX_DELIVERIES - 1);
        when(repo.findByStatusAndHeartbeatAtBefore(QueueItemStatus.PROCESSING, NOW.minus(Duration.ofMinutes(10))))
                .thenReturn(List.of(fresh, lastTry));

        StallRecovery recovery = service.recoverStalled(NOW);

        assertThat(recovery.requeued()).containsExactly(fresh);
        assertThat(recovery.exhausted()).containsExactly(lastTry);
        assertThat(fresh.getStatus()).isEqualTo(QueueItemStatus.QUEUED);
        assertThat(fresh.getRetryCount()).isEqualTo(1);
        assertThat(fresh.getWorkerId()).isNull();
        assertThat(lastTry.getStatus()).isEqualTo(QueueItemStatus.FAILED);
        assertThat(lastTry.getErrorMessage()).contains("after 3 deliveries");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static QueueItem item(int priority, Instant enqueuedAt) {
        return new QueueItem(UUID.randomUUID(), StageId.SCRIBE, Map.of(), priority, "user_set", enqueuedAt);
    }

    private static QueueItem stalled(int redeliveries) {
        QueueItem item = item(5, NOW.minus(Duration.ofHours(1)));
        for (int i = 0; i < redeliveries; i++) {
            item.requeue("earlier stall");
        }
        claimed(item, "worker-dead");
        item.setHeartbeatAt(NOW.minus(Duration.ofMinutes(30)));
        return item;
    }

    /** Put the item in the state the claim query leaves it in. */
    private static void claimed(QueueItem item, String workerId) {
        ReflectionTestUtils.setField(item, "status", QueueItemStatus.PROCESSING);
        ReflectionTestUtils.setField(item, "workerId", workerId);
    }
}
