package com.proxynode.core.services;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import com.proxynode.config.AdminConfig;
import com.proxynode.config.NodeProperties;
import com.proxynode.core.node.NodeStatus;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service providing node metrics via Micrometer and a simple HTTP admin
 * server.
 */
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);
    private final PrometheusMeterRegistry registry;
    private HttpServer adminServer;
    private ExecutorService adminExecutor;
    private AdminConfig config;
    private volatile Supplier<NodeStatus> statusSupplier;

    public MetricsService(NodeProperties properties) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.config = properties.getAdmin();
        setupAdminServer();
    }

    private void setupAdminServer() {
        if (!config.isEnabled()) {
            return;
        }

        try {
            this.adminServer = HttpServer.create(new InetSocketAddress(config.getBindAddress(), config.getPort()), 0);

            // Health check endpoint, with the engine state when known
            adminServer.createContext("/health", exchange -> respond(exchange, healthBody()));

            // Metrics endpoint (Prometheus format)
            adminServer.createContext("/metrics", exchange -> respond(exchange, registry.scrape()));

            this.adminExecutor = Executors.newFixedThreadPool(2, r -> {
                Thread t = new Thread(r, "AdminServer");
                t.setDaemon(true);
                return t;
            });
            adminServer.setExecutor(adminExecutor);
            adminServer.start();
            log.info("Admin server started on port {} (/health, /metrics)", getPort());
        } catch (IOException e) {
            log.error("Failed to start admin server: {}", e.getMessage());
        }
    }

    private String healthBody() {
        Supplier<NodeStatus> supplier = statusSupplier;
        if (supplier == null) {
            return "OK";
        }
        NodeStatus status = supplier.get();
        return "OK\nengine=" + (status.engineRunning() ? "running " + status.engineVersion() : "stopped")
                + "\nnode=" + status.nodeVersion();
    }

    private static void respond(HttpExchange exchange, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * @param statusSupplier Source of the engine state reported by /health.
     */
    public void setStatusSupplier(Supplier<NodeStatus> statusSupplier) {
        this.statusSupplier = statusSupplier;
    }

    /**
     * @return The port the admin server listens on, or -1 if it is not running.
     */
    public int getPort() {
        return adminServer == null ? -1 : adminServer.getAddress().getPort();
    }

    public void updateProperties(NodeProperties properties) {
        AdminConfig newConfig = properties.getAdmin();
        if (newConfig.isEnabled() != config.isEnabled() || newConfig.getPort() != config.getPort()
                || !Objects.equals(newConfig.getBindAddress(), config.getBindAddress())) {
            shutdown();
            this.config = newConfig;
            setupAdminServer();
        }
    }

    public void shutdown() {
        if (adminServer != null) {
            log.info("Stopping admin server...");
            adminServer.stop(0);
            adminServer = null;
        }
        if (adminExecutor != null) {
            adminExecutor.shutdownNow();
            adminExecutor = null;
        }
    }
}
