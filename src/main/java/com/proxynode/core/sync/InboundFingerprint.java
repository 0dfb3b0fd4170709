package com.proxynode.core.sync;

/**
 * Panel-side fingerprint of one inbound's membership.
 *
 * @param tag         Inbound tag, unique within a signal.
 * @param fingerprint 16-hex-digit membership fingerprint.
 * @param memberCount Member count as seen by the panel. Informational only.
 */
public record InboundFingerprint(String tag, String fingerprint, int memberCount) {
}
