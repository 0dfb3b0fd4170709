package com.proxynode.core.engine.memory;

import com.proxynode.core.engine.StatsRegistry;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters named the way the embedded engine names them, e.g.
 * {@code user>>>alice>>>traffic>>>uplink}.
 */
class MemoryStatsRegistry implements StatsRegistry {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    void registerUser(String label) {
        counters.computeIfAbsent("user>>>" + label + ">>>traffic>>>uplink", k -> new AtomicLong());
        counters.computeIfAbsent("user>>>" + label + ">>>traffic>>>downlink", k -> new AtomicLong());
    }

    void registerInbound(String tag) {
        counters.computeIfAbsent("inbound>>>" + tag + ">>>traffic>>>uplink", k -> new AtomicLong());
        counters.computeIfAbsent("inbound>>>" + tag + ">>>traffic>>>downlink", k -> new AtomicLong());
    }

    void set(String name, long value) {
        counters.computeIfAbsent(name, k -> new AtomicLong()).set(value);
    }

    void add(String name, long delta) {
        counters.computeIfAbsent(name, k -> new AtomicLong()).addAndGet(delta);
    }

    @Override
    public long getCounter(String name, boolean reset) {
        AtomicLong counter = counters.get(name);
        if (counter == null) {
            return 0;
        }
        return reset ? counter.getAndSet(0) : counter.get();
    }

    @Override
    public Map<String, Long> snapshot(String prefix, boolean reset) {
        Map<String, Long> result = new TreeMap<>();
        counters.forEach((name, counter) -> {
            if (name.startsWith(prefix)) {
                result.put(name, reset ? counter.getAndSet(0) : counter.get());
            }
        });
        return result;
    }
}
