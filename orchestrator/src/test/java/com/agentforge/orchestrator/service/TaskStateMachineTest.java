package com.agentforge.orchestrator.service;

import com.agentforge.orchestrator.error.InvalidStateException;
import com.agentforge.orchestrator.error.NotFoundException;
import com.agentforge.orchestrator.event.TaskStatusEvent;
import com.agentforge.orchestrator.model.PipelineConfig;
import com.agentforge.orchestrator.model.StageConfig;
import com.agentforge.orchestrator.model.StageId;
import com.agentforge.orchestrator.model.Task;
import com.agentforge.orchestrator.model.TaskStatus;
import com.agentforge.orchestrator.queue.QueueService;
import com.agentforge.orchestrator.repository.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for TaskStateMachine.
 *
 * The repository and queue are mocked; every test starts from a task whose
 * enabled stages are scribe, architect, forge, sentinel and phoenix.
 */
@ExtendWith(MockitoExtension.class)
class TaskStateMachineTest {

    static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock TaskRepository            taskRepo;
    @Mock QueueService              queueService;
    @Mock ApplicationEventPublisher events;

    TaskStateMachine stateMachine;
    Task             task;

    @BeforeEach
    void setUp() {
        stateMachine = new TaskStateMachine(taskRepo, queueService, events, Clock.fixed(NOW, ZoneOffset.UTC));

        PipelineConfig config = PipelineConfig.empty();
        for (StageId stage : StageId.ORDERED) {
            config = config.with(stage, StageConfig.enabledDefaults());
        }
        task = new Task("Add CSV export", "Export reports as CSV", StageId.ORDERED, config, 6);
        ReflectionTestUtils.setField(task, "id", UUID.randomUUID());

        lenient().when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));
        lenient().when(taskRepo.save(any(Task.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    // ------------------------------------------------------------------
    // Stage execution
    // ------------------------------------------------------------------

    @Test
    void startStage_fromPending_movesToProcessingAndPublishes() {
        stateMachine.startStage(task.getId(), StageId.SCRIBE);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(task.getCurrentStage()).isEqualTo(StageId.SCRIBE);

        ArgumentCaptor<TaskStatusEvent> captor = ArgumentCaptor.forClass(TaskStatusEvent.class);
        verify(events).publishEvent(captor.capture());
        assertThat(captor.getValue().status()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(captor.getValue().stage()).isEqualTo(StageId.SCRIBE);
        assertThat(captor.getValue().occurredAt()).isEqualTo(NOW);
    }

    @Test
    void recordStageResult_storesOutputUnderStageKeyAndAddsUsage() {
        stateMachine.recordStageResult(task.getId(), StageId.SCRIBE, Map.of("summary", "doc"), 1200, 0.03, 900);

        assertThat(task.getContext()).containsEntry("scribe_output", Map.of("summary", "doc"));
        assertThat(task.getTotalTokens()).isEqualTo(1200);
        assertThat(task.getStageMetrics().get(StageId.SCRIBE).tokens()).isEqualTo(1200);
    }

    @Test
    void advanceAfter_midPipeline_enqueuesNextStageAtTaskPriority() {
        task.setStatus(TaskStatus.PROCESSING);
        task.setCurrentStage(StageId.SCRIBE);

        stateMachine.advanceAfter(task.getId(), StageId.SCRIBE);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(task.getCurrentStage()).isEqualTo(StageId.ARCHITECT);
        verify(queueService).enqueue(eq(task.getId()), eq(StageId.ARCHITECT), anyMap(), eq(6), eq("user_set"));
    }

    @Test
    void advanceAfter_lastStage_completesTask() {
        task.setStatus(TaskStatus.PROCESSING);
        task.setCurrentStage(StageId.PHOENIX);

        stateMachine.advanceAfter(task.getId(), StageId.PHOENIX);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.getCompletedAt()).isEqualTo(NOW);
        verify(queueService, never()).enqueue(any(), any(), anyMap(), anyInt(), anyString());
    }

    @Test
    void advanceAfter_approvedReleaseCheckpoint_resumesThenCompletes() {
        task.setStatus(TaskStatus.AWAITING_RELEASE);
        task.setCurrentStage(StageId.PHOENIX);

        stateMachine.advanceAfter(task.getId(), StageId.PHOENIX);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        ArgumentCaptor<TaskStatusEvent> captor = ArgumentCaptor.forClass(TaskStatusEvent.class);
        verify(events, times(2)).publishEvent(captor.capture());
        assertThat(captor.getAllValues()).extracting(TaskStatusEvent::status)
                .containsExactly(TaskStatus.PROCESSING, TaskStatus.COMPLETED);
    }

    @Test
    void advanceAfter_clearsFeedbackOfPassedStage() {
        task.setStatus(TaskStatus.PROCESSING);
        task.setCurrentStage(StageId.SCRIBE);
        task.setConfig(task.getConfig().with(StageId.SCRIBE,
                StageConfig.enabledDefaults().withRejectionFeedback(Map.of("comment", "tighten scope"))));

        stateMachine.advanceAfter(task.getId(), StageId.SCRIBE);

        assertThat(task.getConfig().stage(StageId.SCRIBE).hasRejectionFeedback()).isFalse();
    }

    // ------------------------------------------------------------------
    // Checkpoints
    // ------------------------------------------------------------------

    @Test
    void suspend_phoenix_awaitsRelease() {
        task.setStatus(TaskStatus.PROCESSING);

        stateMachine.suspend(task.getId(), StageId.PHOENIX);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.AWAITING_RELEASE);
    }

    @Test
    void suspend_otherStage_awaitsReview() {
        task.setStatus(TaskStatus.PROCESSING);

        stateMachine.suspend(task.getId(), StageId.ARCHITECT);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.AWAITING_REVIEW);
        assertThat(task.getCurrentStage()).isEqualTo(StageId.ARCHITECT);
    }

    @Test
    void rework_mergesFeedbackAndReenqueuesWithBump() {
        task.setStatus(TaskStatus.AWAITING_REVIEW);
        task.setCurrentStage(StageId.ARCHITECT);

        stateMachine.rework(task.getId(), StageId.ARCHITECT, Map.of("fix", "split the migration"), "review_bump");
        stateMachine.suspend(task.getId(), StageId.ARCHITECT);
        stateMachine.rework(task.getId(), StageId.ARCHITECT, Map.of("comment", "still too big"), "review_bump");

        assertThat(task.getStatus()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(task.getConfig().stage(StageId.ARCHITECT).rejectionFeedback())
                .containsEntry("fix", "split the migration")
                .containsEntry("comment", "still too big");
        verify(queueService, times(2)).enqueue(eq(task.getId()), eq(StageId.ARCHITECT),
                anyMap(), eq(6 + TaskStateMachine.REWORK_BUMP), eq("review_bump"));
    }

    @Test
    void reworkAfterFix_countsRetry() {
        task.setStatus(TaskStatus.PROCESSING);
        task.setCurrentStage(StageId.SENTINEL);

        stateMachine.reworkAfterFix(task.getId(), StageId.SENTINEL, Map.of("fix_needed", "add tests"));

        assertThat(task.getRetryCount()).isEqualTo(1);
        verify(queueService).enqueue(eq(task.getId()), eq(StageId.SENTINEL), anyMap(), eq(8), eq("rework"));
    }

    // ------------------------------------------------------------------
    // Illegal transitions and terminal states
    // ------------------------------------------------------------------

    @Test
    void suspend_pendingTask_isIllegal() {
        assertThatThrownBy(() -> stateMachine.suspend(task.getId(), StageId.SCRIBE))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("cannot move from PENDING to AWAITING_REVIEW");
        verify(events, never()).publishEvent(any());
    }

    @Test
    void startStage_completedTask_isIllegal() {
        task.setStatus(TaskStatus.COMPLETED);

        assertThatThrownBy(() -> stateMachine.startStage(task.getId(), StageId.SCRIBE))
                .isInstanceOf(InvalidStateException.class);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    void fail_setsErrorAndCompletionTime() {
        task.setStatus(TaskStatus.AWAITING_REVIEW);

        stateMachine.fail(task.getId(), "Approval timeout at checkpoint scribe_output");

        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getErrorMessage()).isEqualTo("Approval timeout at checkpoint scribe_output");
        assertThat(task.getCompletedAt()).isEqualTo(NOW);
    }

    @Test
    void cancel_cancelledTask_isIllegal() {
        task.setStatus(TaskStatus.CANCELLED);

        assertThatThrownBy(() -> stateMachine.cancel(task.getId(), "again"))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void get_unknownTask_throwsNotFound() {
        UUID unknown = UUID.randomUUID();
        when(taskRepo.findById(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> stateMachine.get(unknown)).isInstanceOf(NotFoundException.class);
    }
}
