package com.proxynode.core.node;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import com.proxynode.core.engine.EngineHandle;
import com.proxynode.core.exceptions.NodeException;
import com.proxynode.core.sync.ConfigSynchronizer;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies start and stop requests to the engine.
 * <p>
 * At most one start push is processed at a time. A push that arrives while
 * another is in flight is rejected with {@link StartOutcome#CONFLICT} instead
 * of queueing. Starts, stops and the user flows of
 * {@link UserHandlerService} share {@link #stateLock()}, so a push never lands
 * between a user change on the engine and the same change on the mirror.
 * </p>
 */
public class NodeController {

    private static final Logger log = LoggerFactory.getLogger(NodeController.class);

    public static final String NODE_VERSION = "1.0.0";

    private final EngineHandle engine;
    private final ConfigSynchronizer mirror;
    private final int apiPort;

    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final ReentrantLock startLock = new ReentrantLock();
    private final List<Runnable> startListeners = new CopyOnWriteArrayList<>();

    private final Counter startedCounter;
    private final Counter unchangedCounter;
    private final Counter failedCounter;
    private final Counter conflictCounter;

    /**
     * @param engine   Engine to drive.
     * @param mirror   Mirror of the running instance's user state.
     * @param registry Meter registry for start counters.
     * @param apiPort  Loopback port of the engine's management API.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public NodeController(EngineHandle engine, ConfigSynchronizer mirror, MeterRegistry registry, int apiPort) {
        this.engine = engine;
        this.mirror = mirror;
        this.apiPort = apiPort;

        this.startedCounter = startCounter(registry, "started");
        this.unchangedCounter = startCounter(registry, "unchanged");
        this.failedCounter = startCounter(registry, "failed");
        this.conflictCounter = startCounter(registry, "conflict");

        Gauge.builder("node.inbounds.tracked", mirror, m -> m.trackedTags().size())
                .description("Inbounds whose users are tracked by fingerprint")
                .register(registry);
    }

    /**
     * Registers a callback run after every successful engine start, for state
     * that must be re-applied to a fresh instance.
     *
     * @param listener Callback. Exceptions it throws are logged.
     */
    public void addStartListener(Runnable listener) {
        startListeners.add(listener);
    }

    /**
     * Brings the engine in line with a start push.
     *
     * @param request The push.
     * @return How the push was handled. Never throws for engine failures.
     */
    public StartResult start(StartRequest request) {
        if (!processing.compareAndSet(false, true)) {
            log.warn("Start request already in progress, rejecting duplicate");
            conflictCounter.increment();
            return new StartResult(StartOutcome.CONFLICT, null,
                    "another start request is already in progress", NODE_VERSION);
        }
        try {
            startLock.lock();
            try {
                return startLocked(request);
            } finally {
                startLock.unlock();
            }
        } finally {
            processing.set(false);
        }
    }

    private StartResult startLocked(StartRequest request) {
        if (engine.isRunning() && !request.forceRestart()) {
            if (!mirror.isRestartNeeded(request.signal())) {
                log.debug("Engine state matches the pushed fingerprints, keeping current instance");
                unchangedCounter.increment();
                return new StartResult(StartOutcome.UNCHANGED, engine.version(), null, NODE_VERSION);
            }
            log.info("Restart required - proceeding with engine restart");
        }

        Map<String, Object> configuration = ApiConfigInjector.inject(request.configuration(), apiPort);

        try {
            engine.start(configuration);
        } catch (NodeException e) {
            log.error("Failed to start engine: {}", e.getMessage());
            // The previous instance is gone too, so the next push must start from scratch.
            mirror.cleanup();
            failedCounter.increment();
            return new StartResult(StartOutcome.FAILED, null, e.getMessage(), NODE_VERSION);
        }
        mirror.extractUsers(request.signal(), configuration);

        startedCounter.increment();
        log.info("Engine {} started with {} tracked inbounds", engine.version(), mirror.trackedTags().size());
        notifyStarted();
        return new StartResult(StartOutcome.STARTED, engine.version(), null, NODE_VERSION);
    }

    /**
     * Stops the engine and forgets the mirrored state, so the next push always
     * restarts.
     *
     * @throws com.proxynode.core.exceptions.EngineLifecycleException if the
     *         instance fails to close. The mirror is left untouched then.
     */
    public void stop() {
        startLock.lock();
        try {
            engine.stop();
            mirror.cleanup();
            log.info("Engine stopped and mirror cleared");
        } finally {
            startLock.unlock();
        }
    }

    /**
     * @return Current engine state. Never blocks on a start in progress.
     */
    public NodeStatus status() {
        boolean running = engine.isRunning();
        return new NodeStatus(running, running ? engine.version() : null, NODE_VERSION, true);
    }

    /**
     * @return Lock held while the engine and the mirror change together. Held
     *         by every start and stop.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public Lock stateLock() {
        return startLock;
    }

    /**
     * @return True while a start push is being processed.
     */
    public boolean isProcessing() {
        return processing.get();
    }

    private void notifyStarted() {
        for (Runnable listener : startListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.error("Start listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private static Counter startCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("node.engine.starts")
                .tag("outcome", outcome)
                .description("Start pushes by outcome")
                .register(registry);
    }
}
