package com.proxynode.core.users;

/**
 * Protocol settings of the inbound a user is being added to.
 *
 * @param type       {@code vless}, {@code trojan} or {@code shadowsocks}.
 * @param tag        Inbound tag.
 * @param flow       VLESS flow, may be empty.
 * @param cipherType Shadowsocks cipher.
 * @param ivCheck    Shadowsocks replay protection.
 */
public record InboundUserData(String type, String tag, String flow, CipherType cipherType, boolean ivCheck) {
}
