package com.proxynode.core.users;

import java.util.Optional;

/**
 * Builds engine users from panel-side user records.
 */
public final class AccountFactory {

    /** Permission level given to every user. */
    public static final int DEFAULT_LEVEL = 0;

    private AccountFactory() {
    }

    public static EngineUser vless(String label, String uuid, String flow) {
        return new EngineUser(label, DEFAULT_LEVEL, new VlessAccount(uuid, flow));
    }

    public static EngineUser trojan(String label, String password) {
        return new EngineUser(label, DEFAULT_LEVEL, new TrojanAccount(password));
    }

    public static EngineUser shadowsocks(String label, String password, CipherType cipherType, boolean ivCheck) {
        return new EngineUser(label, DEFAULT_LEVEL, new ShadowsocksAccount(password, cipherType, ivCheck));
    }

    /**
     * Builds the account matching the inbound's protocol.
     * 
     * @param inbound Inbound protocol settings.
     * @param user    User data.
     * @return The user, or empty when the protocol type is not supported.
     */
    public static Optional<EngineUser> forInbound(InboundUserData inbound, UserData user) {
        String type = inbound.type() == null ? "" : inbound.type();
        return switch (type) {
            case "vless" -> Optional.of(vless(user.userId(), user.vlessUuid(), inbound.flow()));
            case "trojan" -> Optional.of(trojan(user.userId(), user.trojanPassword()));
            case "shadowsocks" -> Optional.of(shadowsocks(user.userId(), user.ssPassword(),
                    inbound.cipherType(), inbound.ivCheck()));
            default -> Optional.empty();
        };
    }
}
