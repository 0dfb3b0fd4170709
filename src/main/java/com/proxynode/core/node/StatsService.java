package com.proxynode.core.node;

import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

import com.proxynode.core.engine.EngineHandle;
import com.proxynode.core.engine.StatsRegistry;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the engine's traffic counters for the panel.
 * <p>
 * Counters follow the engine's naming,
 * {@code <kind>>>><name>>>>traffic>>>uplink|downlink} for kinds {@code user},
 * {@code inbound} and {@code outbound}, plus {@code user>>><name>>>>online}.
 * When no engine is running, or it keeps no counters, every read returns
 * zeros or empty lists.
 * </p>
 */
public class StatsService {

    private static final Logger log = LoggerFactory.getLogger(StatsService.class);

    private static final String SEPARATOR = ">>>";
    private static final String USER = "user";
    private static final String INBOUND = "inbound";
    private static final String OUTBOUND = "outbound";

    private final EngineHandle engine;
    private final long createdNanos = System.nanoTime();

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public StatsService(EngineHandle engine) {
        this.engine = engine;
    }

    /**
     * @param reset Zero the user counters after reading.
     * @return Users with any traffic, sorted by label.
     */
    public List<TrafficStats> usersStats(boolean reset) {
        List<TrafficStats> active = new ArrayList<>();
        for (TrafficStats user : collect(USER, reset)) {
            if (user.uplink() > 0 || user.downlink() > 0) {
                active.add(user);
            }
        }
        return active;
    }

    /**
     * @param username User label.
     * @return True if the engine counts at least one open connection for the
     *         user.
     */
    public boolean isUserOnline(String username) {
        return stats().map(s -> s.getCounter(USER + SEPARATOR + username + SEPARATOR + "online", false) > 0)
                .orElse(false);
    }

    public TrafficStats inboundStats(String tag, boolean reset) {
        return single(INBOUND, tag, reset);
    }

    public TrafficStats outboundStats(String tag, boolean reset) {
        return single(OUTBOUND, tag, reset);
    }

    public List<TrafficStats> allInboundsStats(boolean reset) {
        return collect(INBOUND, reset);
    }

    public List<TrafficStats> allOutboundsStats(boolean reset) {
        return collect(OUTBOUND, reset);
    }

    public CombinedStats combinedStats(boolean reset) {
        return new CombinedStats(collect(INBOUND, reset), collect(OUTBOUND, reset));
    }

    /**
     * @return Figures of the node's own JVM. Available without a running
     *         engine.
     */
    public SystemStats systemStats() {
        long gcCount = 0;
        for (GarbageCollectorMXBean gc : ManagementFactory.getGarbageCollectorMXBeans()) {
            // -1 means the collector does not report a count.
            gcCount += Math.max(0, gc.getCollectionCount());
        }
        MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
        return new SystemStats(
                ManagementFactory.getThreadMXBean().getThreadCount(),
                gcCount,
                memory.getHeapMemoryUsage().getUsed(),
                memory.getHeapMemoryUsage().getCommitted(),
                memory.getNonHeapMemoryUsage().getUsed(),
                TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - createdNanos));
    }

    private TrafficStats single(String kind, String tag, boolean reset) {
        Optional<StatsRegistry> stats = stats();
        if (stats.isEmpty()) {
            return new TrafficStats(tag, 0, 0);
        }
        String prefix = kind + SEPARATOR + tag + SEPARATOR + "traffic" + SEPARATOR;
        return new TrafficStats(tag,
                stats.get().getCounter(prefix + "uplink", reset),
                stats.get().getCounter(prefix + "downlink", reset));
    }

    private List<TrafficStats> collect(String kind, boolean reset) {
        Optional<StatsRegistry> stats = stats();
        if (stats.isEmpty()) {
            return List.of();
        }

        Map<String, long[]> traffic = new TreeMap<>();
        for (String name : stats.get().snapshot(kind + SEPARATOR, false).keySet()) {
            String[] parts = name.split(SEPARATOR, -1);
            if (parts.length < 4 || !"traffic".equals(parts[2])) {
                continue;
            }
            // Re-read so that only traffic counters are reset, never the online ones.
            long value = stats.get().getCounter(name, reset);
            long[] entry = traffic.computeIfAbsent(parts[1], k -> new long[2]);
            if ("uplink".equals(parts[3])) {
                entry[0] = value;
            } else if ("downlink".equals(parts[3])) {
                entry[1] = value;
            }
        }

        List<TrafficStats> result = new ArrayList<>(traffic.size());
        traffic.forEach((name, entry) -> result.add(new TrafficStats(name, entry[0], entry[1])));
        log.debug("Read {} {} counters (reset={})", result.size(), kind, reset);
        return result;
    }

    private Optional<StatsRegistry> stats() {
        return engine.feature(StatsRegistry.class);
    }
}
