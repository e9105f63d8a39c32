package com.linlay.taskrunner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.cache")
public class RunCacheProperties {

    private boolean enabled = false;
    private long ttlSeconds = 3600;
    private int maxEntries = 256;
    private int historyWindow = 3;
    private int historyContentMaxChars = 500;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(long ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    public void setHistoryWindow(int historyWindow) {
        this.historyWindow = historyWindow;
    }

    public int getHistoryContentMaxChars() {
        return historyContentMaxChars;
    }

    public void setHistoryContentMaxChars(int historyContentMaxChars) {
        this.historyContentMaxChars = historyContentMaxChars;
    }
}
