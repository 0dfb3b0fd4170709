package com.proxynode.core.engine;

import java.util.Map;

/**
 * A configuration accepted by an engine provider's loader.
 */
public interface EngineConfig {
    /**
     * @return The object tree the configuration was loaded from.
     */
    Map<String, Object> source();
}
