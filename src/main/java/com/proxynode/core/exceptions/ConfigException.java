package com.proxynode.core.exceptions;

/**
 * Thrown when node or engine configuration is malformed or semantically
 * invalid. Never retried automatically.
 */
public class ConfigException extends NodeException {
    /**
     * Constructs a new ConfigException with the specified detail message.
     * 
     * @param message the detail message.
     */
    public ConfigException(String message) {
        super(message);
    }

    /**
     * Constructs a new ConfigException with the specified detail message and cause.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
