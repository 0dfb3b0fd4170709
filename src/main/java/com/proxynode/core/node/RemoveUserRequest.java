package com.proxynode.core.node;

/**
 * Removes a user from every tracked inbound.
 *
 * @param username User label.
 * @param hashId   Fingerprint member id to drop, may be empty.
 */
public record RemoveUserRequest(String username, String hashId) {

    public RemoveUserRequest {
        hashId = hashId == null ? "" : hashId;
    }
}
