package com.proxynode.spi;

import com.proxynode.core.engine.EngineConfig;
import com.proxynode.core.engine.ProxyEngine;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Service Provider Interface (SPI) for plugging a proxying engine into the
 * node.
 * Implementations should be registered in
 * META-INF/services/com.proxynode.spi.EngineProvider.
 */
public interface EngineProvider {
    /**
     * Retrieves the name this provider is selected by.
     * <p>
     * This corresponds to the 'engine.provider' field in the node
     * configuration.
     * </p>
     * 
     * @return The provider name (case-insensitive).
     */
    String getName();

    /**
     * Returns the engine build identifier. Must not require a running instance.
     * 
     * @return Engine version string.
     */
    String getVersion();

    /**
     * Called once before the first configuration is loaded.
     * 
     * @param assetDirectory Directory holding geo-data files, if one was found.
     */
    default void initialize(Optional<Path> assetDirectory) {
    }

    /**
     * Parses and validates a configuration payload.
     * 
     * @param payload The engine configuration as a JSON-like object tree.
     * @return A validated configuration.
     * @throws com.proxynode.core.exceptions.ConfigException if the payload is
     *                                                       malformed or invalid.
     */
    EngineConfig loadConfig(Map<String, Object> payload);

    /**
     * Creates a new, unstarted engine instance.
     * 
     * @param config A configuration previously returned by {@link #loadConfig}.
     * @return The new instance.
     * @throws com.proxynode.core.exceptions.EngineLifecycleException if the
     *                                                                instance
     *                                                                cannot be
     *                                                                built.
     */
    ProxyEngine create(EngineConfig config);
}
