package com.agentforge.orchestrator.api;

import com.agentforge.orchestrator.api.dto.ApprovalResponse;
import com.agentforge.orchestrator.api.dto.DashboardResponse;
import com.agentforge.orchestrator.api.dto.DecisionRequest;
import com.agentforge.orchestrator.approval.ApprovalService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for checkpoint decisions.
 *
 * GET  /approvals/pending?taskId&checkpoint : open requests, most urgent first
 * GET  /approvals/dashboard?limit           : counts, recent requests and decisions
 * GET  /approvals/{id}                      : one request with its action history
 * GET  /approvals/task/{taskId}             : every request of a task
 * POST /approvals/{id}/approve              : resume the task at the next stage
 * POST /approvals/{id}/reject               : send the stage round again with feedback
 * POST /approvals/check-timeouts            : run the timeout sweep now
 */
@RestController
@RequestMapping("/approvals")
public class ApprovalController {

    private final ApprovalService approvalService;

    public ApprovalController(ApprovalService approvalService) {
        this.approvalService = approvalService;
    }

    @GetMapping("/pending")
    public List<ApprovalResponse> pending(@RequestParam(required = false) UUID taskId,
                                          @RequestParam(required = false) String checkpoint) {
        return approvalService.pending(taskId, checkpoint).stream().map(ApprovalResponse::from).toList();
    }

    @GetMapping("/dashboard")
    public DashboardResponse dashboard(@RequestParam(defaultValue = "10") int limit) {
        return DashboardResponse.from(approvalService.dashboard(limit));
    }

    @GetMapping("/{id}")
    public ApprovalResponse get(@PathVariable UUID id) {
        return ApprovalResponse.withActions(approvalService.get(id));
    }

    @GetMapping("/task/{taskId}")
    public List<ApprovalResponse> forTask(@PathVariable UUID taskId) {
        return approvalService.forTask(taskId).stream().map(ApprovalResponse::from).toList();
    }

    @PostMapping("/{id}/approve")
    public ApprovalResponse approve(@PathVariable UUID id, @Valid @RequestBody DecisionRequest req) {
        return ApprovalResponse.from(approvalService.approve(id, req.actor(), req.comment(), req.feedback()));
    }

    @PostMapping("/{id}/reject")
    public ApprovalResponse reject(@PathVariable UUID id, @Valid @RequestBody DecisionRequest req) {
        return ApprovalResponse.from(approvalService.reject(id, req.actor(), req.comment(), req.feedback()));
    }

    @PostMapping("/check-timeouts")
    public List<ApprovalResponse> checkTimeouts() {
        return approvalService.checkTimeouts().stream().map(ApprovalResponse::from).toList();
    }
}
