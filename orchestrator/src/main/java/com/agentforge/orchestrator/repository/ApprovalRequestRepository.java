package com.agentforge.orchestrator.repository;

import com.agentforge.orchestrator.model.ApprovalRequest;
import com.agentforge.orchestrator.model.ApprovalStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ApprovalRequestRepository extends JpaRepository<ApprovalRequest, UUID> {

    boolean existsByTaskIdAndStatus(UUID taskId, ApprovalStatus status);

    Optional<ApprovalRequest> findFirstByTaskIdAndStatus(UUID taskId, ApprovalStatus status);

    /** Dashboard order: highest checkpoint priority first, oldest first within it. */
    List<ApprovalRequest> findByStatusOrderByPriorityDescCreatedAtAsc(ApprovalStatus status);

    List<ApprovalRequest> findByStatusOrderByCreatedAtDesc(ApprovalStatus status, Pageable page);

    /** PENDING requests whose deadline has passed; rows without a deadline never match. */
    List<ApprovalRequest> findByStatusAndTimeoutAtLessThanEqualOrderByTimeoutAtAsc(
            ApprovalStatus status, Instant now);

    List<ApprovalRequest> findByTaskIdOrderByCreatedAtDesc(UUID taskId);

    long countByStatus(ApprovalStatus status);

    @Query("SELECT r FROM ApprovalRequest r LEFT JOIN FETCH r.actions WHERE r.id = :id")
    Optional<ApprovalRequest> findWithActions(@Param("id") UUID id);
}
