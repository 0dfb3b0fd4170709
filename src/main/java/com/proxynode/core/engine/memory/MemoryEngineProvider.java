package com.proxynode.core.engine.memory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.proxynode.core.engine.EngineConfig;
import com.proxynode.core.engine.ProxyEngine;
import com.proxynode.core.exceptions.ConfigException;
import com.proxynode.core.exceptions.RegistryException;
import com.proxynode.core.users.AccountFactory;
import com.proxynode.core.users.CipherType;
import com.proxynode.core.users.EngineUser;
import com.proxynode.spi.EngineProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Built-in engine that keeps inbounds, users, routing rules and counters in
 * memory without forwarding traffic. Used when no external engine provider is
 * installed, and by tests.
 * <p>
 * Configurations use the same JSON layout as the embedded engine:
 * {@code inbounds[]} with {@code tag}, {@code protocol}, {@code listen},
 * {@code port} and {@code settings.clients[]}, and {@code outbounds[]} with
 * {@code tag} and {@code protocol}.
 * </p>
 */
public class MemoryEngineProvider implements EngineProvider {

    private static final Logger log = LoggerFactory.getLogger(MemoryEngineProvider.class);

    public static final String NAME = "memory";
    public static final String VERSION = "memory-1.0.0";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getVersion() {
        return VERSION;
    }

    @Override
    public void initialize(Optional<Path> assetDirectory) {
        assetDirectory.ifPresent(dir -> log.debug("Memory engine ignores geo assets in {}", dir));
    }

    @Override
    public EngineConfig loadConfig(Map<String, Object> payload) {
        if (payload == null) {
            throw new ConfigException("failed to load config: configuration must be an object");
        }

        List<InboundDefinition> inbounds = new ArrayList<>();
        Set<String> inboundTags = new HashSet<>();
        int index = 0;
        for (Map<?, ?> inbound : objectList(payload.get("inbounds"), "inbounds")) {
            InboundDefinition definition = parseInbound(inbound, index++);
            if (!definition.tag().isEmpty() && !inboundTags.add(definition.tag())) {
                throw new ConfigException("failed to load config: duplicate inbound tag '" + definition.tag() + "'");
            }
            inbounds.add(definition);
        }

        Set<String> outboundTags = new HashSet<>();
        index = 0;
        for (Map<?, ?> outbound : objectList(payload.get("outbounds"), "outbounds")) {
            if (!(outbound.get("protocol") instanceof String)) {
                throw new ConfigException("failed to load config: outbounds[" + index + "] has no protocol");
            }
            if (outbound.get("tag") instanceof String tag && !tag.isEmpty()) {
                outboundTags.add(tag);
            }
            index++;
        }

        if (payload.containsKey("routing") && !(payload.get("routing") instanceof Map)) {
            throw new ConfigException("failed to load config: routing must be an object");
        }

        return new MemoryEngineConfig(payload, inbounds, outboundTags);
    }

    @Override
    public ProxyEngine create(EngineConfig config) {
        if (!(config instanceof MemoryEngineConfig memoryConfig)) {
            throw new ConfigException("configuration was not loaded by the memory engine");
        }
        return new MemoryEngine(memoryConfig);
    }

    private InboundDefinition parseInbound(Map<?, ?> inbound, int index) {
        String where = "inbounds[" + index + "]";
        if (!(inbound.get("protocol") instanceof String protocol) || protocol.isEmpty()) {
            throw new ConfigException("failed to load config: " + where + " has no protocol");
        }
        String tag = inbound.get("tag") instanceof String t ? t : "";
        String listen = inbound.get("listen") instanceof String l ? l : null;
        int port = parsePort(inbound.get("port"), where);

        List<EngineUser> clients = new ArrayList<>();
        if (MemoryUserRegistry.supports(protocol) && inbound.get("settings") instanceof Map<?, ?> settings) {
            int clientIndex = 0;
            for (Map<?, ?> client : objectList(settings.get("clients"), where + ".settings.clients")) {
                EngineUser user = toUser(protocol, settings, client);
                try {
                    MemoryUserRegistry.validate(user);
                } catch (RegistryException e) {
                    throw new ConfigException("failed to load config: " + where + ".settings.clients[" + clientIndex
                            + "]: " + e.getMessage(), e);
                }
                clients.add(user);
                clientIndex++;
            }
        }
        return new InboundDefinition(tag, protocol, listen, port, clients);
    }

    private static EngineUser toUser(String protocol, Map<?, ?> settings, Map<?, ?> client) {
        String secret = string("vless".equals(protocol) ? client.get("id") : client.get("password"));
        // Clients without an email are labelled by their credential.
        String label = client.get("email") instanceof String email && !email.isEmpty() ? email : secret;
        return switch (protocol) {
            case "vless" -> AccountFactory.vless(label, secret, string(client.get("flow")));
            case "trojan" -> AccountFactory.trojan(label, secret);
            default -> {
                Object method = client.containsKey("method") ? client.get("method") : settings.get("method");
                yield AccountFactory.shadowsocks(label, secret, CipherType.parse(string(method)),
                        Boolean.TRUE.equals(client.get("ivCheck")));
            }
        };
    }

    private static int parsePort(Object value, String where) {
        if (value == null) {
            return 0;
        }
        int port;
        if (value instanceof Number number) {
            port = number.intValue();
        } else {
            try {
                port = Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new ConfigException("failed to load config: " + where + " has invalid port '" + value + "'");
            }
        }
        if (port < 0 || port > 65535) {
            throw new ConfigException("failed to load config: " + where + " port out of range: " + port);
        }
        return port;
    }

    private static List<Map<?, ?>> objectList(Object value, String where) {
        List<Map<?, ?>> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigException("failed to load config: " + where + " must be an array");
        }
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new ConfigException("failed to load config: " + where + " must contain objects");
            }
            result.add(map);
        }
        return result;
    }

    private static String string(Object value) {
        return value == null ? "" : value.toString();
    }
}
