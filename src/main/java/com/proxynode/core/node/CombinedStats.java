package com.proxynode.core.node;

import java.util.List;

/**
 * Inbound and outbound traffic read in one call.
 */
public record CombinedStats(List<TrafficStats> inbounds, List<TrafficStats> outbounds) {

    public CombinedStats {
        inbounds = List.copyOf(inbounds);
        outbounds = List.copyOf(outbounds);
    }
}
