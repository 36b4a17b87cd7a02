package com.example.mediagen_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Provider gateway settings. {@code engine=http} talks to the generation gateway at
 * {@link #baseUrl}; {@code engine=simulated} answers locally.
 */
@ConfigurationProperties(prefix = "generation")
public class GenerationProperties {

    private String engine = "simulated";
    private String baseUrl = "http://localhost:3000";
    private String apiKey;
    private long timeoutSeconds = 120;
    private long videoPollIntervalMs = 5000;
    private long videoTimeoutSeconds = 300;

    public String getEngine() {
        return engine;
    }

    public void setEngine(String engine) {
        this.engine = engine;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public long getVideoPollIntervalMs() {
        return videoPollIntervalMs;
    }

    public void setVideoPollIntervalMs(long videoPollIntervalMs) {
        this.videoPollIntervalMs = videoPollIntervalMs;
    }

    public long getVideoTimeoutSeconds() {
        return videoTimeoutSeconds;
    }

    public void setVideoTimeoutSeconds(long videoTimeoutSeconds) {
        this.videoTimeoutSeconds = videoTimeoutSeconds;
    }
}
