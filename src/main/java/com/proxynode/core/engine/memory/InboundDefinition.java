package com.proxynode.core.engine.memory;

import com.proxynode.core.users.EngineUser;
import java.util.List;

/**
 * One validated inbound of a memory engine configuration.
 *
 * @param tag      Inbound tag, may be empty.
 * @param protocol Protocol name.
 * @param listen   Listen address, null for all interfaces.
 * @param port     Listen port, 0 when unset.
 * @param clients  Users declared in {@code settings.clients}.
 */
record InboundDefinition(String tag, String protocol, String listen, int port, List<EngineUser> clients) {

    InboundDefinition {
        clients = List.copyOf(clients);
    }

    boolean hasUserManagement() {
        return MemoryUserRegistry.supports(protocol);
    }
}
