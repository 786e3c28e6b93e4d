package com.agentforge.orchestrator.error;

import com.agentforge.orchestrator.model.StageId;

/**
 * The stage collaborator failed. Fatal to the task unless something outside
 * the executor re-enqueues it.
 */
public class StageExecutionException extends RuntimeException {

    private final StageId stage;

    public StageExecutionException(StageId stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageExecutionException(StageId stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public StageId getStage() { return stage; }
}
