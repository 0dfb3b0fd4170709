package com.proxynode.core.users;

/**
 * Per-user data shared by every inbound a user belongs to.
 *
 * @param userId         Identity label used inside the engine.
 * @param hashId         Identifier tracked in inbound fingerprints.
 * @param vlessUuid      VLESS client UUID.
 * @param trojanPassword Trojan password.
 * @param ssPassword     Shadowsocks password.
 */
public record UserData(String userId, String hashId, String vlessUuid, String trojanPassword, String ssPassword) {

    @Override
    public String toString() {
        return "UserData[userId=" + userId + ", hashId=" + hashId + "]";
    }
}
