package com.proxynode.core.users;

/**
 * Trojan credentials.
 *
 * @param password Trojan password.
 */
public record TrojanAccount(String password) implements ProtocolAccount {

    @Override
    public String protocol() {
        return "trojan";
    }

    @Override
    public String toString() {
        return "TrojanAccount[password=***]";
    }
}
