package com.linlay.taskrunner.agent.runtime;

/**
 * Failure of an external capability (model or tool invocation).
 */
public class CapabilityException extends RuntimeException {

    public CapabilityException(String message) {
        super(message);
    }

    public CapabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
