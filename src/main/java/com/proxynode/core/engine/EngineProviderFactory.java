package com.proxynode.core.engine;

import com.proxynode.core.engine.memory.MemoryEngineProvider;
import com.proxynode.core.exceptions.ConfigException;
import com.proxynode.spi.EngineProvider;
import java.util.ServiceLoader;

/**
 * Resolves the {@link EngineProvider} named in the node configuration.
 */
public final class EngineProviderFactory {

    private EngineProviderFactory() {
    }

    /**
     * Looks up a provider by name.
     * <p>
     * A null or blank name selects the first provider registered through
     * {@link ServiceLoader}, falling back to the built-in memory engine.
     * </p>
     *
     * @param name Provider name (case-insensitive), may be null.
     * @return The provider.
     * @throws ConfigException if no provider has that name.
     */
    public static EngineProvider create(String name) {
        ServiceLoader<EngineProvider> loader = ServiceLoader.load(EngineProvider.class);

        if (name == null || name.isBlank()) {
            for (EngineProvider provider : loader) {
                return provider;
            }
            return new MemoryEngineProvider();
        }

        if (MemoryEngineProvider.NAME.equalsIgnoreCase(name)) {
            return new MemoryEngineProvider();
        }

        for (EngineProvider provider : loader) {
            if (name.equalsIgnoreCase(provider.getName())) {
                return provider;
            }
        }

        throw new ConfigException("Unsupported engine provider: " + name);
    }
}
