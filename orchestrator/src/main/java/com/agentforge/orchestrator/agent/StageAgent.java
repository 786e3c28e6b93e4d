package com.agentforge.orchestrator.agent;

import com.agentforge.orchestrator.model.StageConfig;
import com.agentforge.orchestrator.model.StageId;

import java.util.Map;

/**
 * The work behind one pipeline stage.
 *
 * Every implementation declared as a Spring {@code @Component} is picked up
 * by {@link StageAgentRegistry}; there must be exactly one per stage.
 */
public interface StageAgent {

    StageId stage();

    /**
     * Run the stage once.
     *
     * @param config  the stage's configuration, including any rejection feedback
     * @param context the task's fields plus the outputs of earlier stages
     * @throws com.agentforge.orchestrator.error.StageExecutionException when the
     *         stage cannot produce a result
     */
    StageResult execute(StageConfig config, Map<String, Object> context);
}
