package com.proxynode.core.engine;

import java.util.Map;

/**
 * Traffic counters kept by the engine. Opaque to the control plane beyond
 * reading and resetting.
 */
public interface StatsRegistry extends EngineFeature {
    /**
     * @param name  Counter name, e.g. {@code user>>>alice>>>traffic>>>uplink}.
     * @param reset Reset the counter after reading it.
     * @return Current value, or 0 if the counter does not exist.
     */
    long getCounter(String name, boolean reset);

    /**
     * @param prefix Only counters whose name starts with this are read and
     *               reset. Empty selects every counter.
     * @param reset  Reset the selected counters after reading.
     * @return Selected counters by name.
     */
    Map<String, Long> snapshot(String prefix, boolean reset);
}
