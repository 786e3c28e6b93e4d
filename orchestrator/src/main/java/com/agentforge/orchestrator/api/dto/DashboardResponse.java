package com.agentforge.orchestrator.api.dto;

import com.agentforge.orchestrator.approval.ApprovalDashboard;
import com.agentforge.orchestrator.model.ApprovalStatus;

import java.util.List;
import java.util.Map;

public record DashboardResponse(
        Map<ApprovalStatus, Long>    counts,
        List<ApprovalResponse>       recentPending,
        List<ApprovalActionResponse> recentActions
) {
    public static DashboardResponse from(ApprovalDashboard d) {
        return new DashboardResponse(
                d.counts(),
                d.recentPending().stream().map(ApprovalResponse::from).toList(),
                d.recentActions().stream().map(ApprovalActionResponse::from).toList()
        );
    }
}
