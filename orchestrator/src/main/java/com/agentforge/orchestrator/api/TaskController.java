package com.agentforge.orchestrator.api;

import com.agentforge.orchestrator.api.dto.ApprovalResponse;
import com.agentforge.orchestrator.api.dto.CreateTaskRequest;
import com.agentforge.orchestrator.api.dto.QueueItemResponse;
import com.agentforge.orchestrator.api.dto.TaskResponse;
import com.agentforge.orchestrator.approval.ApprovalService;
import com.agentforge.orchestrator.model.Task;
import com.agentforge.orchestrator.model.TaskStatus;
import com.agentforge.orchestrator.queue.QueueService;
import com.agentforge.orchestrator.service.TaskService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for task lifecycle.
 *
 * POST /tasks                    : create a task and enqueue its first stage
 * GET  /tasks?status=            : list tasks, newest first
 * GET  /tasks/{id}               : current state, context and usage of a task
 * POST /tasks/{id}/cancel        : cancel a task and withdraw its queued work
 * GET  /tasks/{id}/queue-items   : every queue item the task went through
 * GET  /tasks/{id}/approvals     : every checkpoint request of the task
 */
@RestController
@RequestMapping("/tasks")
public class TaskController {

    private final TaskService     taskService;
    private final QueueService    queueService;
    private final ApprovalService approvalService;

    public TaskController(TaskService taskService, QueueService queueService,
                          ApprovalService approvalService) {
        this.taskService     = taskService;
        this.queueService    = queueService;
        this.approvalService = approvalService;
    }

    /**
     * Create a task.
     *
     * Example:
     *   curl -X POST http://localhost:8080/tasks \
     *     -H "Content-Type: application/json" \
     *     -d '{"title":"Add CSV export","stages":{"scribe":{"enabled":true},
     *          "architect":{"enabled":true,"approvalRequired":true}}}'
     */
    @PostMapping
    public ResponseEntity<TaskResponse> create(@Valid @RequestBody CreateTaskRequest req) {
        Task task = taskService.create(req.title(), req.description(), req.stages(), req.priority());
        return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.from(task));
    }

    @GetMapping
    public List<TaskResponse> list(@RequestParam(required = false) TaskStatus status) {
        return taskService.list(status).stream().map(TaskResponse::from).toList();
    }

    @GetMapping("/{id}")
    public TaskResponse get(@PathVariable UUID id) {
        return TaskResponse.from(requireTask(id));
    }

    @PostMapping("/{id}/cancel")
    public TaskResponse cancel(@PathVariable UUID id) {
        return TaskResponse.from(taskService.cancel(id));
    }

    @GetMapping("/{id}/queue-items")
    public List<QueueItemResponse> queueItems(@PathVariable UUID id) {
        requireTask(id);
        return queueService.itemsForTask(id).stream().map(QueueItemResponse::from).toList();
    }

    @GetMapping("/{id}/approvals")
    public List<ApprovalResponse> approvals(@PathVariable UUID id) {
        requireTask(id);
        return approvalService.forTask(id).stream().map(ApprovalResponse::from).toList();
    }

    private Task requireTask(UUID id) {
        return taskService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Task not found: " + id));
    }
}
