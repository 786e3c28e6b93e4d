package com.agentforge.orchestrator;

import com.agentforge.orchestrator.agent.StageAgentRegistry;
import com.agentforge.orchestrator.model.PipelineConfig;
import com.agentforge.orchestrator.model.QueueItem;
import com.agentforge.orchestrator.model.StageConfig;
import com.agentforge.orchestrator.model.StageId;
import com.agentforge.orchestrator.model.Task;
import com.agentforge.orchestrator.queue.QueueService;
import com.agentforge.orchestrator.repository.ApprovalActionRepository;
import com.agentforge.orchestrator.repository.ApprovalRequestRepository;
import com.agentforge.orchestrator.repository.QueueItemRepository;
import com.agentforge.orchestrator.repository.TaskRepository;
import com.agentforge.orchestrator.service.StageExecutor;
import com.agentforge.orchestrator.service.TaskService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Base for tests that run against the full context and the in-memory,
 * Flyway-migrated database. Every test starts from empty tables.
 *
 * The dispatcher is off (agentforge.scheduler.enabled=false), so nothing
 * runs unless the test drives it, and the stage agents are replaced by a
 * mock so no model is ever called.
 */
@SpringBootTest
public abstract class IntegrationTestSupport {

    protected static final String WORKER = "test-worker";

    @Autowired protected TaskRepository            taskRepo;
    @Autowired protected QueueItemRepository       queueItemRepo;
    @Autowired protected ApprovalRequestRepository approvalRequestRepo;
    @Autowired protected ApprovalActionRepository  approvalActionRepo;

    @Autowired protected TaskService   taskService;
    @Autowired protected QueueService  queueService;
    @Autowired protected StageExecutor stageExecutor;

    @MockitoBean protected StageAgentRegistry agents;

    @BeforeEach
    void cleanDatabase() {
        approvalActionRepo.deleteAllInBatch();
        approvalRequestRepo.deleteAllInBatch();
        queueItemRepo.deleteAllInBatch();
        taskRepo.deleteAllInBatch();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** A bare PENDING task whose only enabled stage is SCRIBE, saved without a queue item. */
    protected Task savedTask(String title) {
        PipelineConfig config = PipelineConfig.empty().with(StageId.SCRIBE, StageConfig.enabledDefaults());
        return taskRepo.save(new Task(title, null, List.of(StageId.SCRIBE), config, 5));
    }

    /** Stage configs keyed by stage id, in the order given. */
    protected static Map<String, StageConfig> stages(Object... idsAndConfigs) {
        Map<String, StageConfig> stages = new LinkedHashMap<>();
        for (int i = 0; i < idsAndConfigs.length; i += 2) {
            stages.put((String) idsAndConfigs[i], (StageConfig) idsAndConfigs[i + 1]);
        }
        return stages;
    }

    /** Claim the next item of {@code stage} and run it the way a dispatcher worker would. */
    protected QueueItem runNext(StageId stage) {
        QueueItem item = queueService.dequeue(stage, WORKER).orElseThrow(() ->
                new AssertionError("Nothing queued for " + stage.id()));
        stageExecutor.execute(item);
        return item;
    }

    protected Task reload(Task task) {
        return taskRepo.findById(task.getId()).orElseThrow();
    }

    protected QueueItem reload(QueueItem item) {
        return queueItemRepo.findById(item.getId()).orElseThrow();
    }

    protected void assertNothingQueued(StageId stage) {
        assertThat(queueService.getQueue(stage, false)).isEmpty();
    }
}
