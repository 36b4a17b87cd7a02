package com.example.mediagen_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Admission limits, tick interval and retry policy of the batch scheduler.
 */
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private long tickIntervalMs = 5000;
    private int maxConcurrentJobs = 5;
    private int maxBatchSize = 10;
    private long retryDelayMs = 1000;
    private int defaultMaxRetries = 3;
    private long maxMemoryMb = 2048;
    private double maxCostPerHour = 50;
    /**
     * Second selection pass that fills free slots with any job fitting the resource envelope,
     * regardless of queue order.
     */
    private boolean enableOpportunisticFill = true;
    private int historyLimit = 1000;
    private double resourceAlertThreshold = 0.8;
    private long shutdownTimeoutMs = 30_000;
    private int executorThreads = 6;
    private int executorQueueCapacity = 50;
    private History history = new History();

    public long getTickIntervalMs() {
        return tickIntervalMs;
    }

    public void setTickIntervalMs(long tickIntervalMs) {
        this.tickIntervalMs = tickIntervalMs;
    }

    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    public void setMaxConcurrentJobs(int maxConcurrentJobs) {
        this.maxConcurrentJobs = maxConcurrentJobs;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public void setMaxBatchSize(int maxBatchSize) {
        this.maxBatchSize = maxBatchSize;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public void setRetryDelayMs(long retryDelayMs) {
        this.retryDelayMs = retryDelayMs;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public void setDefaultMaxRetries(int defaultMaxRetries) {
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public long getMaxMemoryMb() {
        return maxMemoryMb;
    }

    public void setMaxMemoryMb(long maxMemoryMb) {
        this.maxMemoryMb = maxMemoryMb;
    }

    public double getMaxCostPerHour() {
        return maxCostPerHour;
    }

    public void setMaxCostPerHour(double maxCostPerHour) {
        this.maxCostPerHour = maxCostPerHour;
    }

    public boolean isEnableOpportunisticFill() {
        return enableOpportunisticFill;
    }

    public void setEnableOpportunisticFill(boolean enableOpportunisticFill) {
        this.enableOpportunisticFill = enableOpportunisticFill;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public double getResourceAlertThreshold() {
        return resourceAlertThreshold;
    }

    public void setResourceAlertThreshold(double resourceAlertThreshold) {
        this.resourceAlertThreshold = resourceAlertThreshold;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public static class History {
        private boolean persistent = false;

        public boolean isPersistent() {
            return persistent;
        }

        public void setPersistent(boolean persistent) {
            this.persistent = persistent;
        }
    }
}
