package com.proxynode.core.engine.memory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.proxynode.core.engine.EngineFeature;
import com.proxynode.core.engine.EngineHandle;
import com.proxynode.core.engine.InboundManager;
import com.proxynode.core.engine.ProxyEngine;
import com.proxynode.core.engine.RoutingRuleRegistry;
import com.proxynode.core.engine.StatsRegistry;
import com.proxynode.core.exceptions.EngineLifecycleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One memory-engine instance. Features are available from construction, as
 * with the embedded engine; {@link #start()} only claims listen addresses.
 */
public class MemoryEngine implements ProxyEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryEngine.class);

    private final MemoryEngineConfig config;
    private final MemoryStatsRegistry stats = new MemoryStatsRegistry();
    private final MemoryInboundManager inbounds;
    private final MemoryRouter router;

    private volatile boolean started;
    private volatile boolean closed;

    MemoryEngine(MemoryEngineConfig config) {
        this.config = config;
        this.inbounds = new MemoryInboundManager(config.inbounds(), stats);
        this.router = new MemoryRouter(config.outboundTags());
    }

    @Override
    public synchronized void start() {
        if (closed) {
            throw new EngineLifecycleException("instance already closed");
        }
        Map<String, String> claimed = new HashMap<>();
        for (InboundDefinition inbound : config.inbounds()) {
            if (inbound.port() == 0) {
                continue;
            }
            String address = (inbound.listen() == null ? "0.0.0.0" : inbound.listen()) + ":" + inbound.port();
            String previous = claimed.putIfAbsent(address, inbound.tag());
            if (previous != null) {
                throw new EngineLifecycleException("inbound '" + inbound.tag() + "' cannot listen on " + address
                        + ": address already used by '" + previous + "'");
            }
        }
        config.inbounds().forEach(inbound -> stats.registerInbound(inbound.tag()));
        started = true;
        log.debug("Memory engine started with {} inbounds", config.inbounds().size());
    }

    @Override
    public synchronized void close() {
        started = false;
        closed = true;
    }

    @Override
    public <T extends EngineFeature> Optional<T> getFeature(Class<T> type) {
        if (type == InboundManager.class) {
            return Optional.of(type.cast(inbounds));
        }
        if (type == RoutingRuleRegistry.class) {
            return Optional.of(type.cast(router));
        }
        if (type == StatsRegistry.class) {
            return Optional.of(type.cast(stats));
        }
        return Optional.empty();
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * Adds traffic to a user's and an inbound's counters.
     *
     * @param inboundTag Inbound the traffic went through.
     * @param label      User label.
     * @param uplink     Bytes sent by the client.
     * @param downlink   Bytes sent to the client.
     */
    public void recordTraffic(String inboundTag, String label, long uplink, long downlink) {
        stats.add("user>>>" + label + ">>>traffic>>>uplink", uplink);
        stats.add("user>>>" + label + ">>>traffic>>>downlink", downlink);
        stats.add("inbound>>>" + inboundTag + ">>>traffic>>>uplink", uplink);
        stats.add("inbound>>>" + inboundTag + ">>>traffic>>>downlink", downlink);
    }

    /**
     * Adds traffic to an outbound's counters.
     *
     * @param outboundTag Outbound the traffic left through.
     * @param uplink      Bytes sent upstream.
     * @param downlink    Bytes received from upstream.
     */
    public void recordOutboundTraffic(String outboundTag, long uplink, long downlink) {
        stats.add("outbound>>>" + outboundTag + ">>>traffic>>>uplink", uplink);
        stats.add("outbound>>>" + outboundTag + ">>>traffic>>>downlink", downlink);
    }

    /**
     * @param label       User label.
     * @param connections Open connections of the user, 0 when offline.
     */
    public void setOnline(String label, int connections) {
        stats.set("user>>>" + label + ">>>online", connections);
    }

    /**
     * @param source Source address literal.
     * @return Outbound chosen by the routing rules, if any matches.
     */
    public Optional<String> route(String source) {
        return router.route(EngineHandle.parseIp(source));
    }
}
