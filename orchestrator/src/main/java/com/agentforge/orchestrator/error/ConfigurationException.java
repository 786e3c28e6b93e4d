package com.agentforge.orchestrator.error;

/**
 * Thrown when a pipeline configuration is invalid: no stage enabled, a gap
 * in the enabled stages, an unknown stage id or a bad stage setting.
 * Raised before any task exists.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
