package com.agentforge.orchestrator.model;

/** Resolution state of an ApprovalRequest. Only PENDING is non-terminal. */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    TIMEOUT
}
