package com.agentforge.orchestrator.repository;

import com.agentforge.orchestrator.model.QueueItemStatus;
import com.agentforge.orchestrator.model.StageId;

/** One row of the per-stage queue summary query. */
public record StageStatusCount(StageId stage, QueueItemStatus status, Long count) {}
