package com.linlay.streamrunner.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "streaming")
public class StreamingProperties {

    @Min(1)
    private int maxConcurrentStreams = 5;
    @Min(0)
    private int reconnectAttempts = 3;
    @Min(0)
    private long reconnectDelayMs = 1000;
    /**
     * Used to estimate progress; only aborts streams when {@link #enforceConnectionTimeout} is set.
     */
    @Min(1)
    private long connectionTimeoutMs = 30_000;
    private boolean enableAutoRetry = true;
    private boolean enableFallback = true;
    @Min(1)
    private long fallbackPollingIntervalMs = 2000;
    private boolean enforceConnectionTimeout = false;
    /**
     * How long a finished stream stays queryable; 0 keeps it until stopped.
     */
    @Min(0)
    private long completedRetentionMs = 300_000;
    @Min(0)
    private int maxRecordedErrors = 100;

    public int getMaxConcurrentStreams() {
        return maxConcurrentStreams;
    }

    public void setMaxConcurrentStreams(int maxConcurrentStreams) {
        this.maxConcurrentStreams = maxConcurrentStreams;
    }

    public int getReconnectAttempts() {
        return reconnectAttempts;
    }

    public void setReconnectAttempts(int reconnectAttempts) {
        this.reconnectAttempts = reconnectAttempts;
    }

    public long getReconnectDelayMs() {
        return reconnectDelayMs;
    }

    public void setReconnectDelayMs(long reconnectDelayMs) {
        this.reconnectDelayMs = reconnectDelayMs;
    }

    public long getConnectionTimeoutMs() {
        return connectionTimeoutMs;
    }

    public void setConnectionTimeoutMs(long connectionTimeoutMs) {
        this.connectionTimeoutMs = connectionTimeoutMs;
    }

    public boolean isEnableAutoRetry() {
        return enableAutoRetry;
    }

    public void setEnableAutoRetry(boolean enableAutoRetry) {
        this.enableAutoRetry = enableAutoRetry;
    }

    public boolean isEnableFallback() {
        return enableFallback;
    }

    public void setEnableFallback(boolean enableFallback) {
        this.enableFallback = enableFallback;
    }

    public long getFallbackPollingIntervalMs() {
        return fallbackPollingIntervalMs;
    }

    public void setFallbackPollingIntervalMs(long fallbackPollingIntervalMs) {
        this.fallbackPollingIntervalMs = fallbackPollingIntervalMs;
    }

    public boolean isEnforceConnectionTimeout() {
        return enforceConnectionTimeout;
    }

    public void setEnforceConnectionTimeout(boolean enforceConnectionTimeout) {
        this.enforceConnectionTimeout = enforceConnectionTimeout;
    }

    public long getCompletedRetentionMs() {
        return completedRetentionMs;
    }

    public void setCompletedRetentionMs(long completedRetentionMs) {
        this.completedRetentionMs = completedRetentionMs;
    }

    public int getMaxRecordedErrors() {
        return maxRecordedErrors;
    }

    public void setMaxRecordedErrors(int maxRecordedErrors) {
        this.maxRecordedErrors = maxRecordedErrors;
    }
}
