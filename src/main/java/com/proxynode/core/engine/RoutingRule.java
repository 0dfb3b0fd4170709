package com.proxynode.core.engine;

import java.net.InetAddress;

/**
 * A routing rule sending traffic from one source CIDR to an outbound.
 *
 * @param ruleTag      Unique rule identifier.
 * @param sourceIp     Network address of the source CIDR.
 * @param prefixLength CIDR prefix length (32 for IPv4 hosts, 128 for IPv6).
 * @param outboundTag  Target outbound.
 */
public record RoutingRule(String ruleTag, InetAddress sourceIp, int prefixLength, String outboundTag) {

    /**
     * @param address A source address.
     * @return True if {@code address} falls inside this rule's source CIDR.
     */
    public boolean matches(InetAddress address) {
        byte[] net = sourceIp.getAddress();
        byte[] candidate = address.getAddress();
        if (net.length != candidate.length) {
            return false;
        }
        int fullBytes = prefixLength / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (net[i] != candidate[i]) {
                return false;
            }
        }
        int remaining = prefixLength % 8;
        if (remaining == 0) {
            return true;
        }
        int mask = (0xff << (8 - remaining)) & 0xff;
        return (net[fullBytes] & mask) == (candidate[fullBytes] & mask);
    }
}
