package com.proxynode.core.node;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

import com.proxynode.core.engine.EngineHandle;
import com.proxynode.core.exceptions.ConfigException;
import com.proxynode.core.exceptions.EngineLifecycleException;
import com.proxynode.core.sync.ConfigSynchronizer;
import com.proxynode.core.users.AccountFactory;
import com.proxynode.core.users.CipherType;
import com.proxynode.core.users.EngineUser;
import com.proxynode.core.users.InboundUserData;
import com.proxynode.core.users.UserData;
import com.proxynode.core.users.UserSynchronizer;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User management flows pushed by the panel between restarts.
 * <p>
 * Every flow first sweeps the user out of the affected inbounds, then adds the
 * new accounts, keeping the engine's registries and the fingerprint mirror in
 * step so the next start push is recognised as unchanged. Each flow holds the
 * node's state lock from the first engine change to the last mirror change.
 * </p>
 */
public class UserHandlerService {

    private static final Logger log = LoggerFactory.getLogger(UserHandlerService.class);

    private final EngineHandle engine;
    private final UserSynchronizer users;
    private final ConfigSynchronizer mirror;
    private final Lock stateLock;

    /**
     * @param engine    Running engine.
     * @param users     User registry access.
     * @param mirror    Fingerprint mirror.
     * @param stateLock Lock shared with start and stop, see
     *                  {@link NodeController#stateLock()}.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public UserHandlerService(EngineHandle engine, UserSynchronizer users, ConfigSynchronizer mirror,
            Lock stateLock) {
        this.engine = engine;
        this.users = users;
        this.mirror = mirror;
        this.stateLock = stateLock;
    }

    /**
     * Replaces one user's accounts.
     *
     * @param request Accounts and fingerprint ids.
     * @throws ConfigException          if the request has no inbounds.
     * @throws EngineLifecycleException if the engine is not running.
     * @throws com.proxynode.core.exceptions.NodeException if an account
     *         cannot be added. Accounts added before it stay added.
     */
    public void addUser(AddUserRequest request) {
        if (request.inbounds().isEmpty()) {
            throw new ConfigException("no inbound data provided");
        }
        stateLock.lock();
        try {
            addUserLocked(request);
        } finally {
            stateLock.unlock();
        }
    }

    private void addUserLocked(AddUserRequest request) {
        requireRunning();

        String username = request.inbounds().get(0).username();
        List<String> tracked = mirror.trackedTags();
        users.removeUserFromAllInbounds(tracked, username);

        String staleHash = request.previousHashId().isEmpty() ? request.hashId() : request.previousHashId();
        if (!staleHash.isEmpty()) {
            tracked.forEach(tag -> mirror.removeUserFromInbound(tag, staleHash));
        }

        for (InboundAccount inbound : request.inbounds()) {
            UserData data = new UserData(inbound.username(), request.hashId(), inbound.uuid(),
                    "trojan".equals(inbound.type()) ? inbound.password() : null,
                    "shadowsocks".equals(inbound.type()) ? inbound.password() : null);
            InboundUserData settings = new InboundUserData(inbound.type(), inbound.tag(), inbound.flow(),
                    CipherType.parse(inbound.cipherType()), inbound.ivCheck());
            addToInbound(settings, data);
        }

        if (!request.hashId().isEmpty()) {
            request.inbounds().forEach(inbound -> mirror.addUserToInbound(inbound.tag(), request.hashId()));
        }
        log.info("User {} added to {} inbounds", username, request.inbounds().size());
    }

    /**
     * Replaces many users' accounts. Stops at the first account that cannot be
     * added; users processed before it keep their new accounts.
     *
     * @param request Users and the inbounds to sweep.
     * @throws EngineLifecycleException if the engine is not running.
     */
    public void addUsers(AddUsersRequest request) {
        if (request.users().isEmpty()) {
            return;
        }
        stateLock.lock();
        try {
            addUsersLocked(request);
        } finally {
            stateLock.unlock();
        }
    }

    private void addUsersLocked(AddUsersRequest request) {
        requireRunning();

        List<String> sweep = request.affectedInboundTags().isEmpty()
                ? mirror.trackedTags()
                : request.affectedInboundTags();

        for (BulkUser entry : request.users()) {
            UserData data = entry.user();
            String hashId = data.hashId() == null ? "" : data.hashId();

            users.removeUserFromAllInbounds(sweep, data.userId());
            if (!hashId.isEmpty()) {
                sweep.forEach(tag -> mirror.removeUserFromInbound(tag, hashId));
            }

            for (InboundUserData inbound : entry.inbounds()) {
                if (addToInbound(inbound, data) && !hashId.isEmpty()) {
                    mirror.addUserToInbound(inbound.tag(), hashId);
                }
            }
        }
        log.info("Bulk added {} users", request.users().size());
    }

    /**
     * Removes a user from every tracked inbound. Missing users are ignored.
     *
     * @param request User and fingerprint id.
     * @throws EngineLifecycleException if the engine is not running.
     */
    public void removeUser(RemoveUserRequest request) {
        removeUsers(List.of(request));
    }

    /**
     * Removes users from every tracked inbound. Missing users are ignored.
     *
     * @param requests Users and fingerprint ids.
     * @throws EngineLifecycleException if the engine is not running.
     */
    public void removeUsers(List<RemoveUserRequest> requests) {
        if (requests.isEmpty()) {
            return;
        }
        stateLock.lock();
        try {
            removeUsersLocked(requests);
        } finally {
            stateLock.unlock();
        }
    }

    private void removeUsersLocked(List<RemoveUserRequest> requests) {
        requireRunning();

        List<String> tracked = mirror.trackedTags();
        for (RemoveUserRequest request : requests) {
            int removed = users.removeUserFromAllInbounds(tracked, request.username());
            if (!request.hashId().isEmpty()) {
                tracked.forEach(tag -> mirror.removeUserFromInbound(tag, request.hashId()));
            }
            log.debug("User {} removed from {} inbounds", request.username(), removed);
        }
        log.info("Removed {} users", requests.size());
    }

    /**
     * @param tag Inbound tag.
     * @return Number of users the running engine holds for the inbound.
     */
    public int inboundUserCount(String tag) {
        requireRunning();
        return users.userCount(tag);
    }

    private boolean addToInbound(InboundUserData inbound, UserData data) {
        Optional<EngineUser> user = AccountFactory.forInbound(inbound, data);
        if (user.isEmpty()) {
            log.error("Failed to build user {} for inbound {}: unsupported type '{}'",
                    data.userId(), inbound.tag(), inbound.type());
            return false;
        }
        users.addUser(inbound.tag(), user.get());
        return true;
    }

    private void requireRunning() {
        if (!engine.isRunning()) {
            throw new EngineLifecycleException("engine not running");
        }
    }
}
