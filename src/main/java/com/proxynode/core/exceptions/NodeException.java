package com.proxynode.core.exceptions;

/**
 * Base exception for all node control-plane errors.
 */
public class NodeException extends RuntimeException {
    /**
     * Constructs a new NodeException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public NodeException(String message) {
        super(message);
    }

    /**
     * Constructs a new NodeException with the specified detail message and cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public NodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
