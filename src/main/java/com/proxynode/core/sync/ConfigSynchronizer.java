package com.proxynode.core.sync;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import com.proxynode.core.hash.HashedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps an in-memory mirror of which users exist in which inbound of the live
 * engine, and decides from it whether a configuration push needs an engine
 * restart.
 * <p>
 * The whole mirror is guarded by one lock. A restart decision walks several
 * entries and must never observe a half-applied rebuild or user mutation.
 * </p>
 */
public class ConfigSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(ConfigSynchronizer.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Empty until the engine has been started at least once. */
    private String baseConfigFingerprint = "";
    private final Map<String, HashedSet> perInboundUsers = new HashMap<>();
    private final Set<String> activeInboundTags = new HashSet<>();
    private Map<String, Object> liveConfiguration;

    /**
     * Decides whether the engine must be restarted to reach the state described
     * by {@code signal}. Checks run in a fixed order and the first hit wins:
     * never started, base configuration changed, inbound count changed, a
     * tracked inbound is missing from the signal, a tracked inbound's
     * fingerprint differs. Only tags tracked by the mirror are walked.
     *
     * @param signal Incoming fingerprints.
     * @return true if a restart is required.
     */
    public boolean isRestartNeeded(RestartSignal signal) {
        lock.readLock().lock();
        try {
            if (baseConfigFingerprint.isEmpty()) {
                return true;
            }

            if (!signal.baseConfigFingerprint().equals(baseConfigFingerprint)) {
                log.warn("Detected changes in engine base configuration");
                return true;
            }

            if (signal.inbounds().size() != perInboundUsers.size()) {
                log.warn("Number of engine inbounds has changed ({} -> {})", perInboundUsers.size(),
                        signal.inbounds().size());
                return true;
            }

            for (Map.Entry<String, HashedSet> entry : perInboundUsers.entrySet()) {
                String tag = entry.getKey();
                InboundFingerprint incoming = signal.find(tag);
                if (incoming == null) {
                    log.warn("Inbound {} no longer exists in engine configuration", tag);
                    return true;
                }

                String current = entry.getValue().fingerprint();
                if (!current.equals(incoming.fingerprint())) {
                    log.warn("User configuration changed for inbound {} (current {}, incoming {})", tag, current,
                            incoming.fingerprint());
                    return true;
                }
            }

            log.info("Engine configuration is up-to-date, no restart required");
            return false;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Rebuilds the mirror from a configuration the engine has just been
     * (re)started with. Only inbounds whose tag appears in {@code signal} are
     * tracked; their members are the {@code settings.clients[].id} values.
     *
     * @param signal        Fingerprints sent with the configuration.
     * @param configuration Full engine configuration object tree.
     */
    public void extractUsers(RestartSignal signal, Map<String, Object> configuration) {
        lock.writeLock().lock();
        try {
            resetLocked();

            baseConfigFingerprint = signal.baseConfigFingerprint();
            liveConfiguration = configuration == null ? null : Collections.unmodifiableMap(configuration);

            log.info("Starting user extraction from inbounds, {} inbounds in signal", signal.inbounds().size());

            if (configuration == null || !(configuration.get("inbounds") instanceof List<?> inbounds)) {
                return;
            }

            Set<String> signalTags = new HashSet<>();
            for (InboundFingerprint inbound : signal.inbounds()) {
                signalTags.add(inbound.tag());
            }

            for (Object raw : inbounds) {
                if (!(raw instanceof Map<?, ?> inbound)) {
                    continue;
                }
                if (!(inbound.get("tag") instanceof String tag) || tag.isEmpty() || !signalTags.contains(tag)) {
                    continue;
                }

                HashedSet users = new HashedSet();
                for (String id : clientIds(inbound)) {
                    users.add(id);
                }
                perInboundUsers.put(tag, users);
                activeInboundTags.add(tag);

                log.info("{} has {} users", tag, users.size());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records that a user was added to an inbound of the live engine. An
     * unknown tag starts being tracked with this single member.
     *
     * @param tag      Inbound tag.
     * @param memberId Identifier tracked in the inbound fingerprint.
     */
    public void addUserToInbound(String tag, String memberId) {
        lock.writeLock().lock();
        try {
            HashedSet users = perInboundUsers.get(tag);
            if (users == null) {
                log.warn("Inbound {} is not tracked, starting to track it", tag);
                users = new HashedSet();
                perInboundUsers.put(tag, users);
                activeInboundTags.add(tag);
            }
            users.add(memberId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records that a user was removed from an inbound of the live engine. When
     * the last member leaves, the inbound stops being tracked. Removing a
     * non-member changes nothing, even on an inbound tracked with no members:
     * inbounds that {@link #extractUsers} installs empty stay tracked until the
     * next rebuild, so the tracked set is not exactly the inbounds with at
     * least one member. A push identical to the last one must still be judged
     * unchanged after such a call.
     *
     * @param tag      Inbound tag.
     * @param memberId Identifier tracked in the inbound fingerprint.
     */
    public void removeUserFromInbound(String tag, String memberId) {
        lock.writeLock().lock();
        try {
            HashedSet users = perInboundUsers.get(tag);
            if (users == null || !users.has(memberId)) {
                return;
            }

            users.delete(memberId);

            if (users.size() == 0) {
                perInboundUsers.remove(tag);
                activeInboundTags.remove(tag);
                log.warn("Inbound {} has no users, no longer tracking it", tag);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Resets the mirror to its never-started state.
     */
    public void cleanup() {
        lock.writeLock().lock();
        try {
            resetLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @param tag Inbound tag.
     * @return The mirror's fingerprint for {@code tag}, or an empty string if
     *         the tag is not tracked.
     */
    public String currentFingerprint(String tag) {
        lock.readLock().lock();
        try {
            HashedSet users = perInboundUsers.get(tag);
            return users == null ? "" : users.fingerprint();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param tag Inbound tag.
     * @return Number of tracked members, 0 if the tag is not tracked.
     */
    public int memberCount(String tag) {
        lock.readLock().lock();
        try {
            HashedSet users = perInboundUsers.get(tag);
            return users == null ? 0 : users.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return Tags currently tracked, in no particular order.
     */
    public List<String> trackedTags() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(activeInboundTags);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return The configuration the engine was last started with, or an empty
     *         map if there is none.
     */
    public Map<String, Object> liveConfiguration() {
        lock.readLock().lock();
        try {
            return liveConfiguration == null ? Collections.emptyMap() : liveConfiguration;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void resetLocked() {
        log.info("Cleaning up config synchronizer");
        perInboundUsers.clear();
        activeInboundTags.clear();
        liveConfiguration = null;
        baseConfigFingerprint = "";
    }

    private static List<String> clientIds(Map<?, ?> inbound) {
        List<String> ids = new ArrayList<>();
        if (!(inbound.get("settings") instanceof Map<?, ?> settings)) {
            return ids;
        }
        if (!(settings.get("clients") instanceof List<?> clients)) {
            return ids;
        }
        for (Object raw : clients) {
            if (raw instanceof Map<?, ?> client && client.get("id") instanceof String id && !id.isEmpty()) {
                ids.add(id);
            }
        }
        return ids;
    }
}
