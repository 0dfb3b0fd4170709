package com.proxynode.core.node;

import java.util.List;

/**
 * Adds many users at once.
 *
 * @param affectedInboundTags Inbounds to sweep existing copies of each user
 *                            from. Empty means every tracked inbound.
 * @param users               The users.
 */
public record AddUsersRequest(List<String> affectedInboundTags, List<BulkUser> users) {

    public AddUsersRequest {
        affectedInboundTags = affectedInboundTags == null ? List.of() : List.copyOf(affectedInboundTags);
        users = users == null ? List.of() : List.copyOf(users);
    }
}
