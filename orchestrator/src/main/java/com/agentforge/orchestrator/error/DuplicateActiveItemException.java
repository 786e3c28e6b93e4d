package com.agentforge.orchestrator.error;

import com.agentforge.orchestrator.model.StageId;

import java.util.UUID;

public class DuplicateActiveItemException extends ConflictException {

    public DuplicateActiveItemException(UUID taskId, StageId stage) {
        super("Task " + taskId + " already has an active item in the " + stage.id() + " queue");
    }

    public DuplicateActiveItemException(UUID taskId, StageId stage, Throwable cause) {
        super("Task " + taskId + " already has an active item in the " + stage.id() + " queue", cause);
    }
}
