package com.agentforge.orchestrator.error;

/**
 * The operation would break a one-active-record invariant (one active queue
 * item per task and stage, one pending approval per task). Callers should
 * retry later, not immediately.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
