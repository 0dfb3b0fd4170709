package com.proxynode.core.users;

/**
 * VLESS credentials.
 *
 * @param id   Client UUID.
 * @param flow Flow control, e.g. {@code xtls-rprx-vision}, or empty.
 */
public record VlessAccount(String id, String flow) implements ProtocolAccount {

    public VlessAccount {
        flow = flow == null ? "" : flow;
    }

    @Override
    public String protocol() {
        return "vless";
    }
}
