package com.proxynode.core.users;

import java.util.Locale;

/**
 * Shadowsocks ciphers understood by the engine. Codes match the engine's own
 * enumeration.
 */
public enum CipherType {
    UNKNOWN(0),
    AES_128_GCM(5),
    AES_256_GCM(6),
    CHACHA20_POLY1305(7),
    XCHACHA20_POLY1305(8),
    NONE(9);

    private final int code;

    CipherType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Parses a cipher name as sent by the panel. Accepts the lowercase method
     * names (including the {@code -ietf-} aliases) and the enum constant names.
     * 
     * @param value Cipher name, may be null.
     * @return The cipher, or {@link #UNKNOWN} if not recognised.
     */
    public static CipherType parse(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        switch (value) {
            case "AES_128_GCM":
                return AES_128_GCM;
            case "AES_256_GCM":
                return AES_256_GCM;
            case "CHACHA20_POLY1305":
                return CHACHA20_POLY1305;
            case "XCHACHA20_POLY1305":
                return XCHACHA20_POLY1305;
            case "NONE":
                return NONE;
            default:
                break;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "aes-128-gcm" -> AES_128_GCM;
            case "aes-256-gcm" -> AES_256_GCM;
            case "chacha20-poly1305", "chacha20-ietf-poly1305" -> CHACHA20_POLY1305;
            case "xchacha20-poly1305", "xchacha20-ietf-poly1305" -> XCHACHA20_POLY1305;
            case "none" -> NONE;
            default -> UNKNOWN;
        };
    }
}
