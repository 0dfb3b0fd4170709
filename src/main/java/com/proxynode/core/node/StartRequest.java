package com.proxynode.core.node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.proxynode.core.exceptions.ConfigException;
import com.proxynode.core.sync.InboundFingerprint;
import com.proxynode.core.sync.RestartSignal;

/**
 * A start push from the control panel.
 *
 * @param configuration Engine configuration object tree.
 * @param signal        Fingerprints the panel computed for that configuration.
 * @param forceRestart  Restart even if the fingerprints match.
 */
public record StartRequest(Map<String, Object> configuration, RestartSignal signal, boolean forceRestart) {

    public StartRequest {
        if (configuration == null) {
            throw new ConfigException("start request has no engine configuration");
        }
        if (signal == null) {
            signal = new RestartSignal("", List.of());
        }
    }

    /**
     * Builds a request from the panel's payload layout:
     *
     * <pre>
     * { "xrayConfig": {...},
     *   "internals": { "forceRestart": false,
     *                  "hashes": { "emptyConfig": "...",
     *                              "inbounds": [ { "tag", "hash", "usersCount" } ] } } }
     * </pre>
     *
     * @param payload Parsed payload.
     * @return The request.
     * @throws ConfigException if a required section is missing or malformed.
     */
    public static StartRequest fromMap(Map<?, ?> payload) {
        if (payload == null) {
            throw new ConfigException("start request is empty");
        }
        if (!(payload.get("xrayConfig") instanceof Map<?, ?> config)) {
            throw new ConfigException("start request requires an 'xrayConfig' object");
        }
        if (!(payload.get("internals") instanceof Map<?, ?> internals)) {
            throw new ConfigException("start request requires an 'internals' object");
        }

        boolean forceRestart = Boolean.TRUE.equals(internals.get("forceRestart"));

        String base = "";
        List<InboundFingerprint> inbounds = new ArrayList<>();
        if (internals.get("hashes") instanceof Map<?, ?> hashes) {
            if (hashes.get("emptyConfig") != null) {
                base = hashes.get("emptyConfig").toString();
            }
            if (hashes.get("inbounds") instanceof List<?> entries) {
                for (Object entry : entries) {
                    if (!(entry instanceof Map<?, ?> inbound)) {
                        throw new ConfigException("internals.hashes.inbounds must contain objects");
                    }
                    inbounds.add(new InboundFingerprint(
                            string(inbound.get("tag")),
                            string(inbound.get("hash")),
                            inbound.get("usersCount") instanceof Number n ? n.intValue() : 0));
                }
            }
        }

        return new StartRequest(stringKeys(config), new RestartSignal(base, inbounds), forceRestart);
    }

    private static Map<String, Object> stringKeys(Map<?, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }

    private static String string(Object value) {
        return value == null ? "" : value.toString();
    }
}
