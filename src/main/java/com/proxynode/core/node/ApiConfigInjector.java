package com.proxynode.core.node;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds the engine's local management API to a pushed configuration: a
 * loopback {@code dokodemo-door} inbound tagged {@value #API_TAG}, a routing
 * rule sending it to the API, the API services and an empty stats section.
 * Sections the configuration already declares are left alone.
 */
public final class ApiConfigInjector {

    public static final String API_TAG = "api";
    public static final String API_LISTEN = "127.0.0.1";
    public static final int DEFAULT_API_PORT = 61012;
    public static final List<String> API_SERVICES = List.of("HandlerService", "LoggerService", "StatsService");

    private ApiConfigInjector() {
    }

    /**
     * @param configuration Pushed configuration. Not modified.
     * @param apiPort       Loopback port for the API inbound.
     * @return A copy with the API sections added.
     */
    public static Map<String, Object> inject(Map<String, Object> configuration, int apiPort) {
        Map<String, Object> result = new LinkedHashMap<>(configuration);

        List<Object> inbounds = result.get("inbounds") instanceof List<?> existing
                ? new ArrayList<>(existing)
                : new ArrayList<>();
        boolean hasApiInbound = inbounds.stream()
                .anyMatch(inbound -> inbound instanceof Map<?, ?> m && API_TAG.equals(m.get("tag")));
        if (!hasApiInbound) {
            inbounds.add(apiInbound(apiPort));
            result.put("inbounds", inbounds);
        }

        Map<String, Object> routing = result.get("routing") instanceof Map<?, ?> existing
                ? copy(existing)
                : new LinkedHashMap<>();
        List<Object> rules = routing.get("rules") instanceof List<?> existing
                ? new ArrayList<>(existing)
                : new ArrayList<>();
        boolean hasApiRule = rules.stream()
                .anyMatch(rule -> rule instanceof Map<?, ?> m && API_TAG.equals(m.get("outboundTag")));
        if (!hasApiRule) {
            Map<String, Object> apiRule = new LinkedHashMap<>();
            apiRule.put("type", "field");
            apiRule.put("outboundTag", API_TAG);
            apiRule.put("inboundTag", new ArrayList<>(List.of(API_TAG)));
            // Must come first so user rules never capture API traffic.
            rules.add(0, apiRule);
            routing.put("rules", rules);
            result.put("routing", routing);
        }

        if (!result.containsKey("api")) {
            Map<String, Object> api = new LinkedHashMap<>();
            api.put("services", new ArrayList<>(API_SERVICES));
            api.put("tag", API_TAG);
            result.put("api", api);
        }

        result.putIfAbsent("stats", new LinkedHashMap<>());
        return result;
    }

    private static Map<String, Object> apiInbound(int apiPort) {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("address", API_LISTEN);

        Map<String, Object> inbound = new LinkedHashMap<>();
        inbound.put("tag", API_TAG);
        inbound.put("port", apiPort);
        inbound.put("listen", API_LISTEN);
        inbound.put("protocol", "dokodemo-door");
        inbound.put("settings", settings);
        return inbound;
    }

    private static Map<String, Object> copy(Map<?, ?> source) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }
}
