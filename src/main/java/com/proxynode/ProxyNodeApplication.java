package com.proxynode;

import com.proxynode.config.AdminConfig;
import com.proxynode.config.EngineSettings;
import com.proxynode.config.NodeProperties;
import com.proxynode.core.engine.EngineHandle;
import com.proxynode.core.engine.EngineProviderFactory;
import com.proxynode.core.engine.GeoAssetLocator;
import com.proxynode.core.exceptions.ConfigException;
import com.proxynode.core.exceptions.NodeException;
import com.proxynode.core.node.CombinedStats;
import com.proxynode.core.node.IpBlockService;
import com.proxynode.core.node.NodeController;
import com.proxynode.core.node.NodeStatus;
import com.proxynode.core.node.StartRequest;
import com.proxynode.core.node.StartRequestReader;
import com.proxynode.core.node.StartResult;
import com.proxynode.core.node.StatsService;
import com.proxynode.core.node.SystemStats;
import com.proxynode.core.node.UserHandlerService;
import com.proxynode.core.services.MetricsService;
import com.proxynode.core.sync.ConfigSynchronizer;
import com.proxynode.core.users.UserSynchronizer;
import com.proxynode.spi.EngineProvider;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.NoSuchElementException;
import java.util.Scanner;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the proxy node.
 * Handles command-line arguments, configuration loading, and the node
 * lifecycle.
 */
@Command(name = "proxy-node", mixinStandardHelpOptions = true, version = NodeController.NODE_VERSION, description = "Control plane of a proxy node.")
public class ProxyNodeApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProxyNodeApplication.class);

    /**
     * Path to the YAML configuration file.
     */
    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)", defaultValue = "node.yml")
    private String configPath;

    /**
     * Start request file, overriding engine.startRequestPath.
     */
    @Option(names = { "-s", "--start-request" }, description = "Start request file (JSON or YAML)")
    private String startRequestOverride;

    private NodeProperties properties;
    private EngineHandle engine;
    private ConfigSynchronizer mirror;
    private NodeController nodeController;
    private UserHandlerService userHandler;
    private IpBlockService ipBlockService;
    private StatsService statsService;
    private MetricsService metricsService;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /** Flag to signal background threads to stop. */
    private final AtomicBoolean running = new AtomicBoolean(true);

    /**
     * Service to watch for start request file changes.
     * Only assigned once during startup and read during shutdown.
     */
    private WatchService watchService;

    /** Reference to the registered shutdown hook for cleanup. */
    private Thread shutdownHook;

    /**
     * Main method to launch the node.
     * 
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        new CommandLine(new ProxyNodeApplication()).execute(args);
    }

    /**
     * Bootstraps the node, pushes the initial start request if one is
     * configured and sets up file watching.
     * 
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting proxy node {}...", NodeController.NODE_VERSION);

            this.properties = loadConfig(configPath);
            EngineSettings settings = properties.getEngine();

            EngineProvider provider = EngineProviderFactory.create(settings.getProvider());
            provider.initialize(new GeoAssetLocator().locate(settings.getAssetPath()));
            log.info("Using engine provider {} ({})", provider.getName(), provider.getVersion());

            this.metricsService = new MetricsService(properties);
            this.engine = new EngineHandle(provider);
            this.mirror = new ConfigSynchronizer();
            this.nodeController = new NodeController(engine, mirror, metricsService.getRegistry(),
                    settings.getApiPort());
            this.userHandler = new UserHandlerService(engine, new UserSynchronizer(engine), mirror,
                    nodeController.stateLock());
            this.ipBlockService = new IpBlockService(engine);
            this.statsService = new StatsService(engine);
            nodeController.addStartListener(ipBlockService::reapply);
            metricsService.setStatusSupplier(nodeController::status);

            String startRequestPath = startRequestPath();
            if (startRequestPath != null) {
                pushStartRequest();
                if (settings.isWatchStartRequest()) {
                    startFileWatcher(startRequestPath);
                }
            }

            if (System.getProperty("proxynode.no-command-listener") == null) {
                startCommandListener();
            }

            if (System.getProperty("proxynode.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            shutdownLatch.await();
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration Error: {}", e.getMessage());
            return 1;
        } catch (NodeException e) {
            log.error("Fatal node error: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            log.warn("Application interrupted");
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Unexpected fatal error", e);
            return 1;
        } finally {
            stop();
        }
    }

    /**
     * Starts an interactive command listener on System.in using a daemon thread.
     */
    private void startCommandListener() {
        Thread listener = new Thread(() -> {
            try (Scanner scanner = new Scanner(System.in, StandardCharsets.UTF_8)) {
                log.info("Interactive console ready. Type 'reload' to re-push the start request or 'stop' to exit.");
                while (running.get() && readAndProcessCommand(scanner)) {
                    // Loop continues as long as input is available and stop hasn't been signaled
                }
            } catch (Exception e) {
                if (running.get()) {
                    log.warn("Command listener fatal error: {}", e.getMessage(), e);
                }
            }
        }, "CommandListener");
        listener.setDaemon(true);
        listener.start();
    }

    /**
     * Reads and processes the next command from the scanner.
     * 
     * @param scanner Input scanner.
     * @return True if a command was processed, false if input was closed.
     */
    private boolean readAndProcessCommand(Scanner scanner) {
        try {
            if (scanner.hasNextLine()) {
                processCommand(scanner.nextLine().trim());
                return true;
            }
        } catch (NoSuchElementException e) {
            log.debug("Console input closed");
        }
        return false;
    }

    /**
     * Processes a single interactive command from the console.
     * 
     * @param line The command line.
     */
    void processCommand(String line) {
        if (line.isEmpty()) {
            return;
        }

        String[] parts = line.split("\\s+", 2);
        String command = parts[0].toLowerCase();
        String argument = parts.length > 1 ? parts[1] : null;

        switch (command) {
            case "reload" -> reload();
            case "status" -> logStatus();
            case "stats" -> logStats("reset".equalsIgnoreCase(argument));
            case "engine-stop" -> stopEngine();
            case "block" -> withIp(argument, ipBlockService::block);
            case "unblock" -> withIp(argument, ipBlockService::unblock);
            case "stop", "exit", "quit" -> stop();
            case "help" -> log.info(
                    "Available commands: reload, status, stats [reset], engine-stop, block <ip>, unblock <ip>, stop, exit, quit, help");
            default -> log.warn("Unknown command: {}. Type 'help' for available commands.", command);
        }
    }

    private void withIp(String ip, Consumer<String> action) {
        if (ip == null) {
            log.warn("An IP address is required");
            return;
        }
        try {
            action.accept(ip);
        } catch (IllegalArgumentException | NodeException e) {
            log.error("IP block command failed: {}", e.getMessage());
        }
    }

    private void logStatus() {
        NodeStatus status = nodeController.status();
        log.info("Engine running: {}, engine version: {}, node version: {}, tracked inbounds: {}",
                status.engineRunning(), status.engineVersion(), status.nodeVersion(), mirror.trackedTags());
    }

    private void logStats(boolean reset) {
        CombinedStats traffic = statsService.combinedStats(reset);
        traffic.inbounds().forEach(t -> log.info("Inbound {}: up {} B, down {} B", t.name(), t.uplink(), t.downlink()));
        traffic.outbounds().forEach(t -> log.info("Outbound {}: up {} B, down {} B", t.name(), t.uplink(), t.downlink()));
        statsService.usersStats(reset).forEach(t -> log.info("User {}: up {} B, down {} B",
                t.name(), t.uplink(), t.downlink()));
        SystemStats system = statsService.systemStats();
        log.info("Threads: {}, GC runs: {}, heap used: {} B, uptime: {} s",
                system.liveThreads(), system.gcCount(), system.heapUsed(), system.uptimeSeconds());
    }

    private void stopEngine() {
        try {
            nodeController.stop();
        } catch (NodeException e) {
            log.error("Failed to stop engine: {}", e.getMessage());
        }
    }

    /**
     * Gracefully stops the engine, file watcher, and background listeners.
     * Also unregisters the shutdown hook to prevent leaks in test
     * environments.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down proxy node...");

            unregisterShutdownHook();

            if (nodeController != null) {
                stopEngine();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            closeWatchService();
            shutdownLatch.countDown();
        }
    }

    /**
     * Unregisters the JVM shutdown hook safely.
     */
    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // Expected when stop() runs inside the hook itself
                log.trace("Shutdown already in progress");
            }
        }
    }

    /**
     * Closes the start request watch service.
     */
    private void closeWatchService() {
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.debug("Failed to close watch service: {}", e.getMessage());
            }
        }
    }

    /**
     * Re-reads node.yml for admin settings and re-pushes the start request.
     */
    void reload() {
        try {
            log.info("Reloading configuration from {}...", configPath);
            NodeProperties newProps = loadConfig(configPath);
            if (!newProps.getEngine().equals(properties.getEngine())) {
                log.warn("Engine settings changed; provider and API port changes apply after a node restart");
            }
            metricsService.updateProperties(newProps);
            this.properties = newProps;
        } catch (ConfigException e) {
            log.error("Failed to reload configuration: {}", e.getMessage());
            return;
        }
        pushStartRequest();
    }

    /**
     * Reads the start request file and hands it to the node controller.
     */
    void pushStartRequest() {
        String path = startRequestPath();
        if (path == null) {
            log.info("No start request file configured");
            return;
        }
        try {
            StartRequest request = StartRequestReader.read(Paths.get(path));
            StartResult result = nodeController.start(request);
            switch (result.outcome()) {
                case STARTED -> log.info("Start request applied, engine {}", result.engineVersion());
                case UNCHANGED -> log.info("Start request matches running engine, nothing to do");
                case CONFLICT -> log.warn("Start request skipped: {}", result.error());
                case FAILED -> log.error("Start request failed: {}", result.error());
                default -> log.warn("Unhandled start outcome {}", result.outcome());
            }
        } catch (ConfigException e) {
            log.error("Failed to read start request: {}", e.getMessage());
        }
    }

    private String startRequestPath() {
        if (startRequestOverride != null && !startRequestOverride.isBlank()) {
            return startRequestOverride;
        }
        String configured = properties == null ? null : properties.getEngine().getStartRequestPath();
        return configured == null || configured.isBlank() ? null : configured;
    }

    /**
     * Starts a background thread to watch for changes in the start request
     * file.
     * Uses a debounce mechanism to avoid multiple pushes for a single logical
     * change.
     * 
     * @param file The file to watch.
     */
    private void startFileWatcher(String file) {
        Thread watcherThread = new Thread(() -> {
            try {
                Path path = Paths.get(file).toAbsolutePath();
                Path parent = path.getParent();
                if (parent == null) {
                    return;
                }

                this.watchService = FileSystems.getDefault().newWatchService();
                parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_CREATE);

                log.info("Watching start request file for changes: {}", path);
                runWatcherLoop(path.getFileName().toString());
            } catch (ClosedWatchServiceException e) {
                log.debug("Watch service closed");
            } catch (InterruptedException e) {
                log.debug("File watcher interrupted");
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                if (running.get()) {
                    log.warn("File watcher error: {}", e.getMessage(), e);
                }
            }
        }, "StartRequestWatcher");
        watcherThread.setDaemon(true);
        watcherThread.start();
    }

    /**
     * Executes the main loop for the start request watcher.
     * 
     * @param fileName The name of the file to watch.
     * @throws InterruptedException If the thread is interrupted.
     */
    private void runWatcherLoop(String fileName) throws InterruptedException {
        // Debounce: track the last event time and push only after 1s of silence.
        final long debounceNanos = 1_000_000_000L;
        long lastEventNano = 0;

        while (running.get()) {
            WatchKey key = watchService.poll(500, TimeUnit.MILLISECONDS);
            if (key != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.context().toString().equals(fileName)) {
                        lastEventNano = System.nanoTime();
                    }
                }
                if (!key.reset()) {
                    break;
                }
            }

            if (lastEventNano > 0 && System.nanoTime() - lastEventNano >= debounceNanos) {
                lastEventNano = 0;
                pushStartRequest();
            }
        }
    }

    /**
     * Loads the configuration from the specified path or classpath.
     * 
     * @param path Path to the configuration file.
     * @return Loaded NodeProperties.
     * @throws ConfigException if configuration cannot be loaded.
     */
    static NodeProperties loadConfig(String path) {
        Yaml yaml = new Yaml(new Constructor(NodeProperties.class, new LoaderOptions()));

        // 1. Try absolute/relative path
        File file = new File(path);
        if (file.exists()) {
            try (InputStream is = new FileInputStream(file)) {
                return orDefaults(yaml.load(is));
            } catch (YAMLException e) {
                throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage());
            } catch (IOException e) {
                throw new ConfigException("Error reading config file: " + path, e);
            }
        }

        // 2. Try classpath
        try (InputStream is = ProxyNodeApplication.class.getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return orDefaults(yaml.load(is));
            }
        } catch (YAMLException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage());
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }

        throw new ConfigException("Configuration file not found: " + path);
    }

    private static NodeProperties orDefaults(NodeProperties loaded) {
        // An empty document, or an empty section, loads as null.
        NodeProperties props = loaded == null ? new NodeProperties() : loaded;
        if (props.getEngine() == null) {
            props.setEngine(new EngineSettings());
        }
        if (props.getAdmin() == null) {
            props.setAdmin(new AdminConfig());
        }
        return props;
    }

    NodeController getNodeController() {
        return nodeController;
    }

    UserHandlerService getUserHandler() {
        return userHandler;
    }

    IpBlockService getIpBlockService() {
        return ipBlockService;
    }

    StatsService getStatsService() {
        return statsService;
    }

    boolean isRunning() {
        return running.get();
    }
}
