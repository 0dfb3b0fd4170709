package com.proxynode.core.engine;

/**
 * Marker for capabilities a running engine may expose.
 */
public interface EngineFeature {
}
