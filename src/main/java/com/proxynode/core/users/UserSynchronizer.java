package com.proxynode.core.users;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import com.proxynode.core.engine.EngineHandle;
import com.proxynode.core.engine.InboundHandler;
import com.proxynode.core.engine.InboundManager;
import com.proxynode.core.engine.UserRegistry;
import com.proxynode.core.exceptions.EngineLifecycleException;
import com.proxynode.core.exceptions.InboundLookupException;
import com.proxynode.core.exceptions.NodeException;
import com.proxynode.core.exceptions.RegistryException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies user additions and removals to the live user registries of the
 * running engine's inbounds. Registries are looked up on every call, so one
 * synchronizer serves every instance the handle starts.
 * All sequences run under one exclusive lock so that concurrent bulk
 * operations never interleave on the same inbound.
 */
public class UserSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(UserSynchronizer.class);

    private final EngineHandle engine;
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * @param engine Handle whose running instance receives the changes.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public UserSynchronizer(EngineHandle engine) {
        this.engine = engine;
    }

    /**
     * Adds a single user to an inbound.
     *
     * @param tag  Inbound tag.
     * @param user The user to add.
     * @throws EngineLifecycleException if no instance is running.
     * @throws InboundLookupException   if the inbound is missing or has no user
     *                                  registry.
     * @throws RegistryException        if the engine rejects the user.
     */
    public void addUser(String tag, EngineUser user) {
        lock.lock();
        try {
            UserRegistry registry = resolveRegistry(tag);
            add(registry, tag, user);
            log.debug("User {} added to inbound {}", user.label(), tag);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds users to an inbound in order, stopping at the first failure. Users
     * added before the failure stay added.
     *
     * @param tag   Inbound tag.
     * @param users The users to add.
     */
    public void addUsers(String tag, List<EngineUser> users) {
        lock.lock();
        try {
            UserRegistry registry = resolveRegistry(tag);
            for (EngineUser user : users) {
                add(registry, tag, user);
            }
            log.debug("{} users added to inbound {}", users.size(), tag);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a user from an inbound by label.
     *
     * @param tag   Inbound tag.
     * @param label User label.
     * @throws InboundLookupException if the inbound is missing or has no user
     *                                registry.
     * @throws RegistryException      if the user is not present.
     */
    public void removeUser(String tag, String label) {
        lock.lock();
        try {
            UserRegistry registry = resolveRegistry(tag);
            remove(registry, tag, label);
            log.debug("User {} removed from inbound {}", label, tag);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes users from an inbound, continuing past individual failures.
     *
     * @param tag    Inbound tag.
     * @param labels User labels.
     * @return Number of users actually removed.
     * @throws InboundLookupException if the inbound is missing or has no user
     *                                registry.
     */
    public int removeUsers(String tag, Collection<String> labels) {
        lock.lock();
        try {
            UserRegistry registry = resolveRegistry(tag);
            int removed = 0;
            for (String label : labels) {
                try {
                    remove(registry, tag, label);
                    removed++;
                } catch (RegistryException e) {
                    log.warn("Failed to remove user {} from inbound {}: {}", label, tag, e.getMessage());
                }
            }
            log.debug("Removed {} of {} users from inbound {}", removed, labels.size(), tag);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a user from every listed inbound. Missing inbounds and missing
     * users are tolerated.
     *
     * @param tags  Inbound tags to sweep.
     * @param label User label.
     * @return Number of inbounds the user was removed from.
     */
    public int removeUserFromAllInbounds(Collection<String> tags, String label) {
        int removed = 0;
        for (String tag : tags) {
            try {
                removeUser(tag, label);
                removed++;
            } catch (NodeException e) {
                log.debug("Could not remove user {} from inbound {}: {}", label, tag, e.getMessage());
            }
        }
        return removed;
    }

    /**
     * @param tag Inbound tag.
     * @return Number of users the engine holds for the inbound.
     */
    public int userCount(String tag) {
        lock.lock();
        try {
            return resolveRegistry(tag).getUserCount();
        } finally {
            lock.unlock();
        }
    }

    private void add(UserRegistry registry, String tag, EngineUser user) {
        try {
            registry.addUser(user);
        } catch (RegistryException e) {
            throw new RegistryException("failed to add user '" + user.label() + "' to inbound '" + tag + "': "
                    + e.getMessage(), e);
        }
    }

    private void remove(UserRegistry registry, String tag, String label) {
        try {
            registry.removeUser(label);
        } catch (RegistryException e) {
            throw new RegistryException("failed to remove user '" + label + "' from inbound '" + tag + "': "
                    + e.getMessage(), e.isNotFound());
        }
    }

    private UserRegistry resolveRegistry(String tag) {
        InboundManager inbounds = engine.feature(InboundManager.class)
                .orElseThrow(() -> new EngineLifecycleException("engine instance not running"));
        InboundHandler handler = inbounds.getHandler(tag)
                .orElseThrow(() -> new InboundLookupException(tag, InboundLookupException.Reason.NOT_FOUND));
        return handler.getUserRegistry()
                .orElseThrow(() -> new InboundLookupException(tag, InboundLookupException.Reason.UNSUPPORTED));
    }
}
