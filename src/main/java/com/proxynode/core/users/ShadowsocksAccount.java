package com.proxynode.core.users;

/**
 * Shadowsocks credentials.
 *
 * @param password   Shadowsocks password.
 * @param cipherType Cipher negotiated for this user.
 * @param ivCheck    Whether replay protection is enabled.
 */
public record ShadowsocksAccount(String password, CipherType cipherType, boolean ivCheck)
        implements ProtocolAccount {

    public ShadowsocksAccount {
        cipherType = cipherType == null ? CipherType.UNKNOWN : cipherType;
    }

    @Override
    public String protocol() {
        return "shadowsocks";
    }

    @Override
    public String toString() {
        return "ShadowsocksAccount[cipherType=" + cipherType + ", ivCheck=" + ivCheck + "]";
    }
}
