package com.proxynode.core.engine.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.proxynode.core.engine.UserRegistry;
import com.proxynode.core.exceptions.RegistryException;
import com.proxynode.core.users.CipherType;
import com.proxynode.core.users.EngineUser;
import com.proxynode.core.users.ShadowsocksAccount;
import com.proxynode.core.users.TrojanAccount;
import com.proxynode.core.users.VlessAccount;

/**
 * Users of one memory-engine inbound, keyed by label. Adding a label that is
 * already present is rejected, as the embedded engine does.
 */
class MemoryUserRegistry implements UserRegistry {

    private static final Set<String> PROTOCOLS = Set.of("vless", "trojan", "shadowsocks");
    private static final Pattern UUID = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
    /** Non-UUID ids up to this length are accepted and mapped by the engine. */
    private static final int MAX_FREEFORM_ID = 30;

    private final String protocol;
    private final MemoryStatsRegistry stats;
    private final Map<String, EngineUser> users = new LinkedHashMap<>();

    MemoryUserRegistry(String protocol, MemoryStatsRegistry stats) {
        this.protocol = protocol;
        this.stats = stats;
    }

    static boolean supports(String protocol) {
        return PROTOCOLS.contains(protocol);
    }

    /**
     * Checks that an account is well-formed for its protocol.
     *
     * @param user The user to check.
     * @throws RegistryException if the account is not acceptable.
     */
    static void validate(EngineUser user) {
        if (user.account() instanceof VlessAccount vless) {
            String id = vless.id();
            if (id == null || id.isEmpty() || (!UUID.matcher(id).matches() && id.length() > MAX_FREEFORM_ID)) {
                throw new RegistryException("invalid VLESS id '" + id + "'", false);
            }
        } else if (user.account() instanceof TrojanAccount trojan) {
            if (trojan.password() == null || trojan.password().isEmpty()) {
                throw new RegistryException("trojan password is empty", false);
            }
        } else if (user.account() instanceof ShadowsocksAccount ss) {
            if (ss.cipherType() == CipherType.UNKNOWN) {
                throw new RegistryException("unsupported shadowsocks cipher", false);
            }
            if (ss.cipherType() != CipherType.NONE && (ss.password() == null || ss.password().isEmpty())) {
                throw new RegistryException("shadowsocks password is empty", false);
            }
        } else {
            throw new RegistryException("missing account", false);
        }
    }

    @Override
    public synchronized void addUser(EngineUser user) {
        if (!protocol.equals(user.account().protocol())) {
            throw new RegistryException("account protocol " + user.account().protocol()
                    + " does not match inbound protocol " + protocol, false);
        }
        validate(user);
        if (users.containsKey(user.label())) {
            throw new RegistryException("User " + user.label() + " already exists", false);
        }
        users.put(user.label(), user);
        stats.registerUser(user.label());
    }

    @Override
    public synchronized void removeUser(String label) {
        if (label == null || label.isEmpty()) {
            throw new RegistryException("empty label", true);
        }
        if (users.remove(label) == null) {
            throw new RegistryException("User " + label + " not found", true);
        }
    }

    @Override
    public synchronized int getUserCount() {
        return users.size();
    }

    synchronized List<String> labels() {
        return new ArrayList<>(users.keySet());
    }
}
