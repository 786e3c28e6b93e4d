package com.agentforge.orchestrator.api;

import com.agentforge.orchestrator.api.dto.BoostRequest;
import com.agentforge.orchestrator.api.dto.PriorityRequest;
import com.agentforge.orchestrator.api.dto.QueueItemResponse;
import com.agentforge.orchestrator.api.dto.StallRecoveryResponse;
import com.agentforge.orchestrator.model.StageId;
import com.agentforge.orchestrator.queue.QueueCounts;
import com.agentforge.orchestrator.queue.QueueService;
import com.agentforge.orchestrator.queue.StageActivityProjection;
import com.agentforge.orchestrator.queue.StageActivityProjection.StageActivity;
import com.agentforge.orchestrator.service.TaskService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API over the per-stage queues.
 *
 * GET   /queues                        : queued / processing counts per stage
 * GET   /queues/{stage}                : one stage's queue in service order
 * PATCH /queues/items/{id}/priority    : set an absolute priority
 * POST  /queues/items/{id}/boost       : raise priority by a delta
 * POST  /queues/items/{id}/promote     : jump to the maximum priority
 * POST  /queues/apply-aging            : run the aging sweep now
 * GET   /queues/activity               : what each stage is running right now
 * POST  /queues/recover-stalled        : run stalled-worker recovery now
 */
@RestController
@RequestMapping("/queues")
public class QueueController {

    private final QueueService            queueService;
    private final StageActivityProjection activity;
    private final TaskService             taskService;

    public QueueController(QueueService queueService, StageActivityProjection activity,
                           TaskService taskService) {
        this.queueService = queueService;
        this.activity     = activity;
        this.taskService  = taskService;
    }

    @GetMapping
    public Map<String, QueueCounts> summary() {
        Map<String, QueueCounts> byId = new LinkedHashMap<>();
        queueService.summary().forEach((stage, counts) -> byId.put(stage.id(), counts));
        return byId;
    }

    @GetMapping("/activity")
    public List<StageActivity> activity() {
        return activity.snapshot();
    }

    @GetMapping("/{stage}")
    public List<QueueItemResponse> queue(@PathVariable String stage,
                                         @RequestParam(defaultValue = "false") boolean includeProcessing) {
        StageId id = StageId.fromId(stage).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown stage: " + stage));
        return queueService.getQueue(id, includeProcessing).stream().map(QueueItemResponse::from).toList();
    }

    @PatchMapping("/items/{id}/priority")
    public QueueItemResponse setPriority(@PathVariable UUID id, @Valid @RequestBody PriorityRequest req) {
        return QueueItemResponse.from(queueService.setPriority(id, req.priority(), req.reason()));
    }

    @PostMapping("/items/{id}/boost")
    public QueueItemResponse boost(@PathVariable UUID id,
                                   @Valid @RequestBody(required = false) BoostRequest req) {
        BoostRequest boost = req == null ? new BoostRequest(null, null) : req;
        return QueueItemResponse.from(queueService.boostPriority(id, boost.delta(), boost.reason()));
    }

    @PostMapping("/items/{id}/promote")
    public QueueItemResponse promote(@PathVariable UUID id) {
        return QueueItemResponse.from(queueService.promoteToMax(id));
    }

    @PostMapping("/apply-aging")
    public Map<String, Integer> applyAging() {
        return Map.of("updated", queueService.applyAging());
    }

    @PostMapping("/recover-stalled")
    public StallRecoveryResponse recoverStalled() {
        return StallRecoveryResponse.from(taskService.recoverStalledItems());
    }
}
