package com.proxynode.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Root configuration object for the proxy node.
 * Maps to the top-level structure of node.yml.
 */
public class NodeProperties {
    /**
     * Engine configuration.
     */
    private EngineSettings engine = new EngineSettings();

    /**
     * Administration and metrics configuration.
     */
    private AdminConfig admin = new AdminConfig();

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public EngineSettings getEngine() {
        return engine;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setEngine(EngineSettings engine) {
        this.engine = engine;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }
}
