package com.proxynode.core.engine.memory;

import com.proxynode.core.engine.InboundHandler;
import com.proxynode.core.engine.UserRegistry;
import java.util.Optional;

/**
 * A memory-engine inbound. Only VLESS, Trojan and Shadowsocks inbounds carry a
 * user registry.
 */
class MemoryInboundHandler implements InboundHandler {

    private final InboundDefinition definition;
    private final MemoryUserRegistry users;

    MemoryInboundHandler(InboundDefinition definition, MemoryStatsRegistry stats) {
        this.definition = definition;
        if (definition.hasUserManagement()) {
            this.users = new MemoryUserRegistry(definition.protocol(), stats);
            definition.clients().forEach(users::addUser);
        } else {
            this.users = null;
        }
    }

    @Override
    public String getTag() {
        return definition.tag();
    }

    @Override
    public String getProtocol() {
        return definition.protocol();
    }

    @Override
    public Optional<UserRegistry> getUserRegistry() {
        return Optional.ofNullable(users);
    }
}
