package com.agentforge.orchestrator.error;

/**
 * An illegal state transition: resolving an approval that is no longer
 * PENDING, or moving a task out of a terminal status.
 */
public class InvalidStateException extends RuntimeException {

    public InvalidStateException(String message) {
        super(message);
    }
}
