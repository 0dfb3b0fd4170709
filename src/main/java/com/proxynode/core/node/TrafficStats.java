package com.proxynode.core.node;

/**
 * Traffic of one user, inbound or outbound.
 *
 * @param name     User label or tag.
 * @param uplink   Bytes sent by the client.
 * @param downlink Bytes sent to the client.
 */
public record TrafficStats(String name, long uplink, long downlink) {
}
