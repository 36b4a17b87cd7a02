package com.example.mediagen_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

    private long maxSizeBytes = 1024L * 1024 * 1024;
    private Duration maxAge = Duration.ofDays(7);
    private Duration cleanupInterval = Duration.ofMinutes(30);
    private double maxEntryFraction = 0.1;
    private double maxMediaEntryFraction = 0.2;
    private double evictionTargetRatio = 0.8;
    private Persistence persistence = new Persistence();

    public long getMaxSizeBytes() {
        return maxSizeBytes;
    }

    public void setMaxSizeBytes(long maxSizeBytes) {
        this.maxSizeBytes = maxSizeBytes;
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    public void setMaxAge(Duration maxAge) {
        this.maxAge = maxAge;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public void setCleanupInterval(Duration cleanupInterval) {
        this.cleanupInterval = cleanupInterval;
    }

    public double getMaxEntryFraction() {
        return maxEntryFraction;
    }

    public void setMaxEntryFraction(double maxEntryFraction) {
        this.maxEntryFraction = maxEntryFraction;
    }

    public double getMaxMediaEntryFraction() {
        return maxMediaEntryFraction;
    }

    public void setMaxMediaEntryFraction(double maxMediaEntryFraction) {
        this.maxMediaEntryFraction = maxMediaEntryFraction;
    }

    public double getEvictionTargetRatio() {
        return evictionTargetRatio;
    }

    public void setEvictionTargetRatio(double evictionTargetRatio) {
        this.evictionTargetRatio = evictionTargetRatio;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    public static class Persistence {
        private boolean enabled = false;
        private String path = "./data/cache/snapshot.json";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }
}
