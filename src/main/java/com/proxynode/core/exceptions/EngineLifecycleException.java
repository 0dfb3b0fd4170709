package com.proxynode.core.exceptions;

/**
 * Thrown when the engine cannot be stopped, created or started, or when an
 * operation needs a running engine and none is available.
 */
public class EngineLifecycleException extends NodeException {
    /**
     * Constructs a new EngineLifecycleException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public EngineLifecycleException(String message) {
        super(message);
    }

    /**
     * Constructs a new EngineLifecycleException with the specified detail message
     * and cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public EngineLifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
