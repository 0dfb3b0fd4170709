package com.proxynode.core.sync;

import java.util.List;

/**
 * Expected post-push state sent with every configuration push.
 *
 * @param baseConfigFingerprint Identifies the non-user part of the
 *                              configuration.
 * @param inbounds              Per-inbound membership fingerprints.
 */
public record RestartSignal(String baseConfigFingerprint, List<InboundFingerprint> inbounds) {

    public RestartSignal {
        baseConfigFingerprint = baseConfigFingerprint == null ? "" : baseConfigFingerprint;
        inbounds = inbounds == null ? List.of() : List.copyOf(inbounds);
    }

    /**
     * @param tag Inbound tag.
     * @return The first entry with that tag, or null.
     */
    public InboundFingerprint find(String tag) {
        for (InboundFingerprint inbound : inbounds) {
            if (inbound.tag().equals(tag)) {
                return inbound;
            }
        }
        return null;
    }
}
