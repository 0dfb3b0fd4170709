package com.proxynode.core.engine.memory;

import com.proxynode.core.engine.EngineConfig;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration accepted by {@link MemoryEngineProvider}.
 */
final class MemoryEngineConfig implements EngineConfig {

    private final Map<String, Object> source;
    private final List<InboundDefinition> inbounds;
    private final Set<String> outboundTags;

    MemoryEngineConfig(Map<String, Object> source, List<InboundDefinition> inbounds, Set<String> outboundTags) {
        this.source = Collections.unmodifiableMap(source);
        this.inbounds = List.copyOf(inbounds);
        this.outboundTags = Set.copyOf(outboundTags);
    }

    @Override
    public Map<String, Object> source() {
        return source;
    }

    List<InboundDefinition> inbounds() {
        return inbounds;
    }

    Set<String> outboundTags() {
        return outboundTags;
    }
}
