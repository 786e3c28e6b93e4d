package com.agentforge.orchestrator.approval;

import com.agentforge.orchestrator.error.ConflictException;
import com.agentforge.orchestrator.error.InvalidStateException;
import com.agentforge.orchestrator.error.NotFoundException;
import com.agentforge.orchestrator.model.ApprovalRequest;
import com.agentforge.orchestrator.model.ApprovalStatus;
import com.agentforge.orchestrator.model.StageId;
import com.agentforge.orchestrator.model.Task;
import com.agentforge.orchestrator.repository.ApprovalActionRepository;
import com.agentforge.orchestrator.repository.ApprovalRequestRepository;
import com.agentforge.orchestrator.service.TaskStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Checkpoint controller: suspends a task for a human decision and resumes it.
 *
 * A task has at most one PENDING request. Approval moves the task on to the
 * next enabled stage; rejection sends it back to the same stage with the
 * reviewer's feedback; a passed deadline either auto-approves or fails the
 * task, depending on the stage configuration.
 */
@Service
public class ApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    public static final String SYSTEM_ACTOR = "system";

    private final ApprovalRequestRepository requestRepo;
    private final ApprovalActionRepository  actionRepo;
    private final TaskStateMachine          stateMachine;
    private final TransactionTemplate       tx;
    private final Clock                     clock;

    public ApprovalService(ApprovalRequestRepository requestRepo,
                           ApprovalActionRepository actionRepo,
                           TaskStateMachine stateMachine,
                           TransactionTemplate tx,
                           Clock clock) {
        this.requestRepo  = requestRepo;
        this.actionRepo   = actionRepo;
        this.stateMachine = stateMachine;
        this.tx           = tx;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Suspension
    // ------------------------------------------------------------------

    /**
     * Open a checkpoint for {@code stage} and suspend the task.
     *
     * @param timeoutMinutes null for a request that never times out
     * @throws ConflictException if the task already has a PENDING request
     */
    @Transactional
    public ApprovalRequest create(UUID taskId, StageId stage, List<String> artifacts, String summary,
                                  Map<String, Object> details, Integer timeoutMinutes,
                                  boolean autoApproveOnTimeout) {
        if (requestRepo.existsByTaskIdAndStatus(taskId, ApprovalStatus.PENDING)) {
            throw new ConflictException("Task " + taskId + " already has a pending approval request");
        }

        Instant now = clock.instant();
        Instant timeoutAt = timeoutMinutes == null ? null : now.plus(Duration.ofMinutes(timeoutMinutes));
        ApprovalRequest request = new ApprovalRequest(taskId, stage, artifacts, summary, details,
                now, timeoutAt, autoApproveOnTimeout);
        try {
            request = requestRepo.saveAndFlush(request);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Task " + taskId + " already has a pending approval request", e);
        }

        stateMachine.suspend(taskId, stage);
        log.info("Approval request {} created for task {} at {} (timeout={})",
                request.getId(), taskId, request.getCheckpoint(), timeoutAt);
        return request;
    }

    // ------------------------------------------------------------------
    // Decisions
    // ------------------------------------------------------------------

    @Transactional
    public ApprovalRequest approve(UUID requestId, String actor, String comment,
                                   Map<String, Object> feedback) {
        ApprovalRequest request = pendingRequest(requestId);
        request.resolve(ApprovalStatus.APPROVED, ApprovalStatus.APPROVED, actor, comment, feedback,
                clock.instant());
        requestRepo.save(request);

        log.info("Approval {} APPROVED by {} (task {}, {})",
                requestId, actor, request.getTaskId(), request.getCheckpoint());
        stateMachine.advanceAfter(request.getTaskId(), request.getStage());
        return request;
    }

    /**
     * Reject a checkpoint. The feedback map and the comment are merged into
     * the stage's rejection feedback so the next run of the stage sees them.
     *
     * @throws IllegalArgumentException if {@code comment} is blank
     */
    @Transactional
    public ApprovalRequest reject(UUID requestId, String actor, String comment,
                                  Map<String, Object> feedback) {
        if (comment == null || comment.isBlank()) {
            throw new IllegalArgumentException("A comment is required when rejecting");
        }
        ApprovalRequest request = pendingRequest(requestId);
        request.resolve(ApprovalStatus.REJECTED, ApprovalStatus.REJECTED, actor, comment, feedback,
                clock.instant());
        requestRepo.save(request);

        Map<String, Object> merged = new LinkedHashMap<>();
        if (feedback != null) merged.putAll(feedback);
        merged.put("comment", comment);

        log.info("Approval {} REJECTED by {} (task {}, {}): {}",
                requestId, actor, request.getTaskId(), request.getCheckpoint(), comment);
        stateMachine.rework(request.getTaskId(), request.getStage(), merged, "review_bump");
        return request;
    }

    /**
     * Resolve every PENDING request whose deadline has passed.
     *
     * Auto-approve requests resume the pipeline as if the system actor had
     * approved them; the rest become TIMEOUT and fail their task. Running it
     * again with the same {@code now} resolves nothing.
     *
     * Each request is resolved in its own transaction. A request that cannot
     * be resolved is logged and left PENDING; the others still resolve.
     *
     * @return the requests resolved by this sweep
     */
    public List<ApprovalRequest> checkTimeouts(Instant now) {
        List<UUID> expired = requestRepo
                .findByStatusAndTimeoutAtLessThanEqualOrderByTimeoutAtAsc(ApprovalStatus.PENDING, now)
                .stream().map(ApprovalRequest::getId).toList();

        List<ApprovalRequest> resolved = new ArrayList<>();
        for (UUID requestId : expired) {
            try {
                ApprovalRequest request = tx.execute(status -> resolveExpired(requestId, now));
                if (request != null) {
                    resolved.add(request);
                }
            } catch (RuntimeException e) {
                log.error("Could not resolve expired approval {}: {}", requestId, e.getMessage(), e);
            }
        }
        return resolved;
    }

    public List<ApprovalRequest> checkTimeouts() {
        return checkTimeouts(clock.instant());
    }

    /** Resolve one expired request, or return null if it was decided meanwhile. */
    private ApprovalRequest resolveExpired(UUID requestId, Instant now) {
        ApprovalRequest request = requestRepo.findById(requestId).orElse(null);
        if (request == null || request.getStatus() != ApprovalStatus.PENDING) {
            return null;
        }
        Task task = stateMachine.get(request.getTaskId());
        if (request.isAutoApproveOnTimeout()) {
            request.resolve(ApprovalStatus.APPROVED, ApprovalStatus.TIMEOUT, SYSTEM_ACTOR,
                    "Auto-approved on timeout", null, now);
            requestRepo.save(request);
            log.info("Approval {} auto-approved on timeout (task {})", request.getId(), task.getId());
            if (task.getStatus().isAwaiting()) {
                stateMachine.advanceAfter(task.getId(), request.getStage());
            }
        } else {
            request.resolve(ApprovalStatus.TIMEOUT, ApprovalStatus.TIMEOUT, SYSTEM_ACTOR,
                    "Approval timed out", null, now);
            requestRepo.save(request);
            log.warn("Approval {} timed out (task {}, {})",
                    request.getId(), task.getId(), request.getCheckpoint());
            if (!task.getStatus().isTerminal()) {
                stateMachine.fail(task.getId(),
                        "Approval timeout at checkpoint " + request.getCheckpoint());
            }
        }
        return request;
    }

    /** Withdraw the task's PENDING request, if any, as part of cancelling the task. */
    @Transactional
    public void cancelPending(UUID taskId) {
        requestRepo.findFirstByTaskIdAndStatus(taskId, ApprovalStatus.PENDING).ifPresent(request -> {
            request.resolve(ApprovalStatus.REJECTED, ApprovalStatus.REJECTED, SYSTEM_ACTOR,
                    "Task cancelled", null, clock.instant());
            requestRepo.save(request);
            log.info("Approval {} withdrawn: task {} cancelled", request.getId(), taskId);
        });
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** PENDING requests, most urgent checkpoint first; both filters are optional. */
    @Transactional(readOnly = true)
    public List<ApprovalRequest> pending(UUID taskId, String checkpoint) {
        return requestRepo.findByStatusOrderByPriorityDescCreatedAtAsc(ApprovalStatus.PENDING).stream()
                .filter(r -> taskId == null || taskId.equals(r.getTaskId()))
                .filter(r -> checkpoint == null || checkpoint.equalsIgnoreCase(r.getCheckpoint()))
                .toList();
    }

    /** One request with its action history loaded. */
    @Transactional(readOnly = true)
    public ApprovalRequest get(UUID requestId) {
        return requestRepo.findWithActions(requestId)
                .orElseThrow(() -> NotFoundException.of("Approval request", requestId));
    }

    @Transactional(readOnly = true)
    public List<ApprovalRequest> forTask(UUID taskId) {
        return requestRepo.findByTaskIdOrderByCreatedAtDesc(taskId);
    }

    @Transactional(readOnly = true)
    public ApprovalDashboard dashboard(int limit) {
        Map<ApprovalStatus, Long> counts = new EnumMap<>(ApprovalStatus.class);
        for (ApprovalStatus status : ApprovalStatus.values()) {
            counts.put(status, requestRepo.countByStatus(status));
        }
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        return new ApprovalDashboard(
                counts,
                requestRepo.findByStatusOrderByCreatedAtDesc(ApprovalStatus.PENDING, page),
                actionRepo.findRecent(page));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ApprovalRequest pendingRequest(UUID requestId) {
        ApprovalRequest request = requestRepo.findById(requestId)
                .orElseThrow(() -> NotFoundException.of("Approval request", requestId));
        if (!request.isPending()) {
            throw new InvalidStateException("Approval request " + requestId
                    + " is already resolved (status=" + request.getStatus() + ")");
        }
        return request;
    }
}
