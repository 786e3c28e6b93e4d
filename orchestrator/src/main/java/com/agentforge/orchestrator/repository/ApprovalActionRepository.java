package com.agentforge.orchestrator.repository;

import com.agentforge.orchestrator.model.ApprovalAction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.UUID;

/** Read side of the append-only approval action log. */
public interface ApprovalActionRepository extends JpaRepository<ApprovalAction, UUID> {

    // Fetches the request too so callers can read its id and checkpoint outside the session.
    @Query("SELECT a FROM ApprovalAction a JOIN FETCH a.request ORDER BY a.createdAt DESC")
    List<ApprovalAction> findRecent(Pageable page);
}
