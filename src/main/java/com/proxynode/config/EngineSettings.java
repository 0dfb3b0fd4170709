package com.proxynode.config;

import java.util.Objects;

/**
 * Settings for the embedded proxying engine.
 */
public class EngineSettings {
    /** Engine provider name. Null selects the first installed provider. */
    private String provider;

    /** Directory with geo-data files. Null triggers discovery. */
    private String assetPath;

    /** Local port of the engine's management API inbound. */
    private int apiPort = 61012;

    /**
     * Optional file holding a start request (engine configuration plus
     * fingerprints) pushed at startup and on every change.
     */
    private String startRequestPath;

    /** Whether to watch {@link #startRequestPath} for changes. */
    private boolean watchStartRequest = true;

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getAssetPath() {
        return assetPath;
    }

    public void setAssetPath(String assetPath) {
        this.assetPath = assetPath;
    }

    public int getApiPort() {
        return apiPort;
    }

    public void setApiPort(int apiPort) {
        this.apiPort = apiPort;
    }

    public String getStartRequestPath() {
        return startRequestPath;
    }

    public void setStartRequestPath(String startRequestPath) {
        this.startRequestPath = startRequestPath;
    }

    public boolean isWatchStartRequest() {
        return watchStartRequest;
    }

    public void setWatchStartRequest(boolean watchStartRequest) {
        this.watchStartRequest = watchStartRequest;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EngineSettings that = (EngineSettings) o;
        return apiPort == that.apiPort &&
               watchStartRequest == that.watchStartRequest &&
               Objects.equals(provider, that.provider) &&
               Objects.equals(assetPath, that.assetPath) &&
               Objects.equals(startRequestPath, that.startRequestPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, assetPath, apiPort, startRequestPath, watchStartRequest);
    }
}
