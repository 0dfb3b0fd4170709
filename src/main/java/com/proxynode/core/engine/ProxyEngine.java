package com.proxynode.core.engine;

import java.util.Optional;

/**
 * A single instance of the embedded proxying engine.
 */
public interface ProxyEngine extends AutoCloseable {
    /**
     * Starts the instance and opens all configured inbounds.
     * 
     * @throws com.proxynode.core.exceptions.EngineLifecycleException on failure.
     */
    void start();

    /**
     * Releases the instance. Closing a partially started instance is allowed.
     * 
     * @throws com.proxynode.core.exceptions.EngineLifecycleException on failure.
     */
    @Override
    void close();

    /**
     * Looks up a capability by type.
     * 
     * @param type The capability interface.
     * @param <T>  The capability type.
     * @return The capability, or empty if this instance does not provide it.
     */
    <T extends EngineFeature> Optional<T> getFeature(Class<T> type);
}
