package com.proxynode.core.users;

/**
 * Protocol-specific secret material of an engine user.
 */
public interface ProtocolAccount {
    /**
     * @return Protocol name as used in inbound configuration.
     */
    String protocol();
}
