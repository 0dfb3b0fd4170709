package com.proxynode.core.engine;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

import com.proxynode.core.exceptions.ConfigException;
import com.proxynode.core.exceptions.EngineLifecycleException;
import com.proxynode.core.exceptions.RegistryException;
import com.proxynode.spi.EngineProvider;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns zero or one running engine instance.
 * Start, stop and restart are mutually exclusive; status reads share a read
 * lock and never block each other.
 */
public class EngineHandle {

    private static final Logger log = LoggerFactory.getLogger(EngineHandle.class);

    /** Accepts IPv4 dotted quads and anything containing ':' (IPv6 literals). */
    private static final Pattern IP_LITERAL = Pattern.compile("^(\\d{1,3}(\\.\\d{1,3}){3}|[0-9A-Fa-f:.]*:[0-9A-Fa-f:.]*)$");

    private final EngineProvider provider;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private ProxyEngine instance;
    private boolean running;

    /**
     * @param provider Provider used to load configurations and build instances.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public EngineHandle(EngineProvider provider) {
        this.provider = provider;
    }

    /**
     * Starts a new instance, stopping the current one first.
     *
     * @param configuration Engine configuration object tree.
     * @throws ConfigException          if the configuration is rejected.
     * @throws EngineLifecycleException if the previous instance cannot be
     *                                  stopped or the new one cannot be created
     *                                  or started.
     */
    public void start(Map<String, Object> configuration) {
        lock.writeLock().lock();
        try {
            if (running) {
                try {
                    stopLocked();
                } catch (EngineLifecycleException e) {
                    throw new EngineLifecycleException("failed to stop existing instance: " + e.getMessage(), e);
                }
            }

            EngineConfig config = provider.loadConfig(configuration);

            ProxyEngine created;
            try {
                created = provider.create(config);
            } catch (ConfigException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new EngineLifecycleException("failed to create engine instance: " + e.getMessage(), e);
            }

            try {
                created.start();
            } catch (RuntimeException e) {
                closeQuietly(created);
                throw new EngineLifecycleException("failed to start engine: " + e.getMessage(), e);
            }

            instance = created;
            running = true;
            log.info("Engine {} started successfully", provider.getVersion());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Equivalent to {@link #start(Map)}, which already stops a running
     * instance.
     *
     * @param configuration Engine configuration object tree.
     */
    public void restart(Map<String, Object> configuration) {
        start(configuration);
    }

    /**
     * Stops the running instance. A no-op when nothing is running.
     *
     * @throws EngineLifecycleException if the instance fails to close.
     */
    public void stop() {
        lock.writeLock().lock();
        try {
            stopLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isRunning() {
        lock.readLock().lock();
        try {
            return running;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return The engine build identifier, available whether or not an
     *         instance is running.
     */
    public String version() {
        return provider.getVersion();
    }

    /**
     * @return The running instance, or empty.
     */
    public Optional<ProxyEngine> instance() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(instance);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Queries the running instance for a capability.
     *
     * @param type Capability interface.
     * @param <T>  Capability type.
     * @return The capability, or empty if nothing is running or the instance
     *         does not provide it.
     */
    public <T extends EngineFeature> Optional<T> feature(Class<T> type) {
        return instance().flatMap(engine -> engine.getFeature(type));
    }

    /**
     * Validates a configuration without starting anything.
     *
     * @param configuration Engine configuration object tree.
     * @throws ConfigException if the configuration is rejected.
     */
    public void validate(Map<String, Object> configuration) {
        if (configuration == null) {
            throw new ConfigException("configuration must be an object");
        }
        provider.loadConfig(configuration);
    }

    /**
     * Adds a rule routing traffic from one source address to an outbound.
     *
     * @param ruleTag     Unique rule id.
     * @param sourceIp    IPv4 or IPv6 literal. Matched as a /32 or /128.
     * @param outboundTag Target outbound.
     * @throws EngineLifecycleException if no instance is running or its router
     *                                  has no dynamic rule support.
     * @throws IllegalArgumentException if {@code sourceIp} is not an IP
     *                                  literal.
     * @throws RegistryException        if the router rejects the rule.
     */
    public void addRoutingRule(String ruleTag, String sourceIp, String outboundTag) {
        RoutingRuleRegistry router = router();

        InetAddress address = parseIp(sourceIp);
        int prefix = address instanceof Inet4Address ? 32 : 128;

        try {
            router.addRule(new RoutingRule(ruleTag, address, prefix, outboundTag), true);
        } catch (RegistryException e) {
            throw new RegistryException("failed to add routing rule: " + e.getMessage(), e);
        }

        log.info("Added routing rule {} ({} -> {})", ruleTag, sourceIp, outboundTag);
    }

    /**
     * Removes a routing rule. Removing a rule that does not exist succeeds.
     *
     * @param ruleTag Rule id.
     * @throws EngineLifecycleException if no instance is running or its router
     *                                  has no dynamic rule support.
     */
    public void removeRoutingRule(String ruleTag) {
        RoutingRuleRegistry router = router();
        try {
            router.removeRule(ruleTag);
        } catch (RegistryException e) {
            if (e.isNotFound()) {
                log.warn("Routing rule {} not found, may already be removed", ruleTag);
                return;
            }
            throw new RegistryException("failed to remove routing rule: " + e.getMessage(), e);
        }
        log.info("Removed routing rule {}", ruleTag);
    }

    /**
     * Parses an IP literal without ever resolving a host name.
     *
     * @param value Candidate address.
     * @return The address.
     * @throws IllegalArgumentException if {@code value} is not an IP literal.
     */
    public static InetAddress parseIp(String value) {
        if (value == null || !IP_LITERAL.matcher(value).matches()) {
            throw new IllegalArgumentException("invalid IP address: " + value);
        }
        if (value.indexOf(':') < 0) {
            for (String octet : value.split("\\.")) {
                if (Integer.parseInt(octet) > 255) {
                    throw new IllegalArgumentException("invalid IP address: " + value);
                }
            }
        }
        try {
            return InetAddress.getByName(value);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException("invalid IP address: " + value, e);
        }
    }

    private RoutingRuleRegistry router() {
        lock.readLock().lock();
        try {
            if (instance == null) {
                throw new EngineLifecycleException("engine instance not running");
            }
            return instance.getFeature(RoutingRuleRegistry.class)
                    .orElseThrow(() -> new EngineLifecycleException("router does not support dynamic rule management"));
        } finally {
            lock.readLock().unlock();
        }
    }

    private void stopLocked() {
        if (instance == null) {
            return;
        }

        ProxyEngine closing = instance;
        // The handle is released even when close fails, so a later start can retry.
        instance = null;
        running = false;
        try {
            closing.close();
        } catch (RuntimeException e) {
            throw new EngineLifecycleException("failed to close engine instance: " + e.getMessage(), e);
        }
        log.info("Engine stopped");
    }

    private void closeQuietly(ProxyEngine engine) {
        try {
            engine.close();
        } catch (RuntimeException e) {
            log.debug("Failed to close partially started engine: {}", e.getMessage());
        }
    }
}
