package com.agentforge.orchestrator.error;

/** The record does not exist, or is not in the state the operation needs. */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException of(String kind, Object id) {
        return new NotFoundException(kind + " not found: " + id);
    }
}
