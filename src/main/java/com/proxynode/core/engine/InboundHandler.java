package com.proxynode.core.engine;

import java.util.Optional;

/**
 * A named listening endpoint inside the engine.
 */
public interface InboundHandler {
    String getTag();

    String getProtocol();

    /**
     * @return The per-user registry, or empty if this inbound's protocol has
     *         no user management.
     */
    Optional<UserRegistry> getUserRegistry();
}
