package com.proxynode.core.exceptions;

/**
 * Thrown by an engine registry (users or routing rules) when it rejects a
 * mutation.
 */
public class RegistryException extends NodeException {

    private final boolean notFound;

    /**
     * Constructs a new RegistryException.
     * 
     * @param message  the detail message.
     * @param notFound whether the entry targeted by the mutation does not exist.
     */
    public RegistryException(String message, boolean notFound) {
        super(message);
        this.notFound = notFound;
    }

    /**
     * Constructs a new RegistryException for a rejected entry.
     * 
     * @param message the detail message.
     * @param cause   the cause of the exception.
     */
    public RegistryException(String message, Throwable cause) {
        super(message, cause);
        this.notFound = false;
    }

    /**
     * Whether the mutation failed because its target was absent.
     * 
     * @return true for remove-of-missing-entry failures.
     */
    public boolean isNotFound() {
        return notFound;
    }
}
