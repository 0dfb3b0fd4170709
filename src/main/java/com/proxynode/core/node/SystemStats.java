package com.proxynode.core.node;

/**
 * Runtime figures of the node process.
 *
 * @param liveThreads    Live JVM threads.
 * @param gcCount        Collections run by all garbage collectors.
 * @param heapUsed       Heap bytes in use.
 * @param heapCommitted  Heap bytes committed by the JVM.
 * @param nonHeapUsed    Non-heap bytes in use.
 * @param uptimeSeconds  Seconds since the stats service was created.
 */
public record SystemStats(int liveThreads, long gcCount, long heapUsed, long heapCommitted, long nonHeapUsed,
        long uptimeSeconds) {
}
