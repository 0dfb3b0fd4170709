package com.proxynode.core.node;

import java.util.List;

/**
 * Adds (or re-adds) one user to a set of inbounds.
 *
 * @param inbounds       Per-inbound account data. All entries share the
 *                       same username.
 * @param hashId         Fingerprint member id of the user after the change,
 *                       may be empty.
 * @param previousHashId Member id the user had before, may be empty.
 */
public record AddUserRequest(List<InboundAccount> inbounds, String hashId, String previousHashId) {

    public AddUserRequest {
        inbounds = inbounds == null ? List.of() : List.copyOf(inbounds);
        hashId = hashId == null ? "" : hashId;
        previousHashId = previousHashId == null ? "" : previousHashId;
    }
}
