package com.proxynode.core.engine;

import com.proxynode.core.users.EngineUser;

/**
 * Live user accounts of a single inbound.
 */
public interface UserRegistry {
    /**
     * Adds an account. Whether an existing label is replaced or rejected is up
     * to the engine.
     * 
     * @param user The account to add.
     * @throws com.proxynode.core.exceptions.RegistryException if rejected.
     */
    void addUser(EngineUser user);

    /**
     * Removes an account by its label.
     * 
     * @param label The account label.
     * @throws com.proxynode.core.exceptions.RegistryException if the label is
     *                                                         not present.
     */
    void removeUser(String label);

    int getUserCount();
}
