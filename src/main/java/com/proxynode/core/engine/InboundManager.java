package com.proxynode.core.engine;

import java.util.List;
import java.util.Optional;

/**
 * Registry of the inbound handlers of a running engine.
 */
public interface InboundManager extends EngineFeature {
    /**
     * @param tag Inbound tag.
     * @return The handler, or empty if no inbound has that tag.
     */
    Optional<InboundHandler> getHandler(String tag);

    /**
     * @return Tags of all inbounds, in configuration order.
     */
    List<String> getTags();
}
