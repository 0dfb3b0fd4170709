package com.proxynode.core.node;

/**
 * One inbound a single user is added to.
 *
 * @param tag        Inbound tag.
 * @param username   User label.
 * @param type       Inbound protocol: vless, trojan or shadowsocks.
 * @param uuid       VLESS id.
 * @param flow       VLESS flow.
 * @param password   Trojan or Shadowsocks password.
 * @param cipherType Shadowsocks cipher name.
 * @param ivCheck    Shadowsocks IV replay check.
 */
public record InboundAccount(String tag, String username, String type, String uuid, String flow,
        String password, String cipherType, boolean ivCheck) {

    @Override
    public String toString() {
        return "InboundAccount[tag=" + tag + ", username=" + username + ", type=" + type + "]";
    }
}
