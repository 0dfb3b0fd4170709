package com.proxynode.core.engine.memory;

import com.proxynode.core.engine.InboundHandler;
import com.proxynode.core.engine.InboundManager;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

class MemoryInboundManager implements InboundManager {

    private final Map<String, MemoryInboundHandler> handlers = new LinkedHashMap<>();

    MemoryInboundManager(List<InboundDefinition> inbounds, MemoryStatsRegistry stats) {
        for (InboundDefinition inbound : inbounds) {
            if (!inbound.tag().isEmpty()) {
                handlers.put(inbound.tag(), new MemoryInboundHandler(inbound, stats));
            }
        }
    }

    @Override
    public Optional<InboundHandler> getHandler(String tag) {
        return Optional.ofNullable(handlers.get(tag));
    }

    @Override
    public List<String> getTags() {
        return new ArrayList<>(handlers.keySet());
    }
}
