package com.agentforge.orchestrator.api;

import com.agentforge.orchestrator.approval.ApprovalDashboard;
import com.agentforge.orchestrator.approval.ApprovalService;
import com.agentforge.orchestrator.error.ConflictException;
import com.agentforge.orchestrator.error.NotFoundException;
import com.agentforge.orchestrator.model.ApprovalRequest;
import com.agentforge.orchestrator.model.ApprovalStatus;
import com.agentforge.orchestrator.model.StageId;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for ApprovalController.
 */
@WebMvcTest(ApprovalController.class)
class ApprovalControllerTest {

    @Autowired MockMvc mockMvc;

    @MockitoBean ApprovalService approvalService;

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Test
    void pending_passesFilters() throws Exception {
        ApprovalRequest request = fakeRequest(StageId.PHOENIX);
        when(approvalService.pending(request.getTaskId(), "phoenix_release")).thenReturn(List.of(request));

        mockMvc.perform(get("/approvals/pending")
                        .param("taskId", request.getTaskId().toString())
                        .param("checkpoint", "phoenix_release"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].checkpoint").value("phoenix_release"))
                .andExpect(jsonPath("$[0].stage").value("phoenix"))
                .andExpect(jsonPath("$[0].priority").value(5))
                .andExpect(jsonPath("$[0].actions").doesNotExist());
    }

    @Test
    void get_unknownRequest_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(approvalService.get(id)).thenThrow(NotFoundException.of("Approval request", id));

        mockMvc.perform(get("/approvals/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void get_includesActionHistory() throws Exception {
        ApprovalRequest request = fakeRequest(StageId.ARCHITECT);
        request.resolve(ApprovalStatus.APPROVED, ApprovalStatus.APPROVED, "alice", "ok", null, Instant.now());
        when(approvalService.get(request.getId())).thenReturn(request);

        mockMvc.perform(get("/approvals/{id}", request.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.actions[0].actor").value("alice"))
                .andExpect(jsonPath("$.actions[0].checkpoint").value("architect_plan"));
    }

    @Test
    void dashboard_returnsCountsPerStatus() throws Exception {
        Map<ApprovalStatus, Long> counts = new EnumMap<>(ApprovalStatus.class);
        counts.put(ApprovalStatus.PENDING, 2L);
        counts.put(ApprovalStatus.TIMEOUT, 1L);
        when(approvalService.dashboard(5)).thenReturn(new ApprovalDashboard(counts, List.of(), List.of()));

        mockMvc.perform(get("/approvals/dashboard").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.counts.PENDING").value(2))
                .andExpect(jsonPath("$.counts.TIMEOUT").value(1));
    }

    // ------------------------------------------------------------------
    // Decisions
    // ------------------------------------------------------------------

    @Test
    void approve_returnsResolvedRequest() throws Exception {
        ApprovalRequest request = fakeRequest(StageId.SCRIBE);
        request.resolve(ApprovalStatus.APPROVED, ApprovalStatus.APPROVED, "alice", null, null, Instant.now());
        when(approvalService.approve(eq(request.getId()), eq("alice"), isNull(), isNull())).thenReturn(request);

        mockMvc.perform(post("/approvals/{id}/approve", request.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"));
    }

    @Test
    void approve_withoutActor_returns400() throws Exception {
        mockMvc.perform(post("/approvals/{id}/approve", UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"comment\":\"fine\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(approvalService);
    }

    @Test
    void reject_withoutComment_returns400() throws Exception {
        UUID id = UUID.randomUUID();
        when(approvalService.reject(eq(id), eq("bob"), isNull(), any()))
                .thenThrow(new IllegalArgumentException("A comment is required when rejecting"));

        mockMvc.perform(post("/approvals/{id}/reject", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"bob\",\"feedback\":{\"fix\":\"X\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("A comment is required when rejecting"));
    }

    @Test
    void reject_conflict_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(approvalService.reject(eq(id), eq("bob"), eq("redo"), any()))
                .thenThrow(new ConflictException("Task already has a pending approval request"));

        mockMvc.perform(post("/approvals/{id}/reject", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\":\"bob\",\"comment\":\"redo\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void checkTimeouts_returnsResolvedRequests() throws Exception {
        ApprovalRequest request = fakeRequest(StageId.FORGE);
        request.resolve(ApprovalStatus.TIMEOUT, ApprovalStatus.TIMEOUT, "system", "Approval timed out",
                null, Instant.now());
        when(approvalService.checkTimeouts()).thenReturn(List.of(request));

        mockMvc.perform(post("/approvals/check-timeouts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("TIMEOUT"))
                .andExpect(jsonPath("$[0].checkpoint").value("forge_code"));
    }

    private static ApprovalRequest fakeRequest(StageId stage) {
        Instant now = Instant.now();
        ApprovalRequest request = new ApprovalRequest(UUID.randomUUID(), stage, List.of("PLAN.md"),
                "summary", Map.of(), now, now.plus(Duration.ofHours(1)), false);
        ReflectionTestUtils.setField(request, "id", UUID.randomUUID());
        return request;
    }
}
