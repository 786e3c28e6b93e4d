package com.agentforge.orchestrator.approval;

import com.agentforge.orchestrator.model.ApprovalAction;
import com.agentforge.orchestrator.model.ApprovalRequest;
import com.agentforge.orchestrator.model.ApprovalStatus;

import java.util.List;
import java.util.Map;

/** Counts per status plus the most recent pending requests and decisions. */
public record ApprovalDashboard(
        Map<ApprovalStatus, Long> counts,
        List<ApprovalRequest>     recentPending,
        List<ApprovalAction>      recentActions
) {}
