package com.proxynode.core.node;

import java.util.List;

import com.proxynode.core.users.InboundUserData;
import com.proxynode.core.users.UserData;

/**
 * One user of a bulk add: shared credentials plus the inbounds to join.
 *
 * @param user     Credentials and ids.
 * @param inbounds Inbounds to add the user to.
 */
public record BulkUser(UserData user, List<InboundUserData> inbounds) {

    public BulkUser {
        inbounds = inbounds == null ? List.of() : List.copyOf(inbounds);
    }
}
