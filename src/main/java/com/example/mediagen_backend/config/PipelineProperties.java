package com.example.mediagen_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Orchestrator tuning: per-stage cache models and thresholds, pacing delays, retry policy and
 * the price list used for cost estimates.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private Stage images = new Stage("dall-e-3", "openai", 0.9, 1000);
    private Stage audio = new Stage("eleven_turbo_v2_5", "elevenlabs", 1.0, 500);
    private Stage videos = new Stage("gen3a_turbo", "runway", 0.85, 2000);
    private long retryBaseDelayMs = 1000;
    private int defaultBatchSize = 3;
    private int defaultMaxRetries = 3;
    private int executorThreads = 8;
    private int executorQueueCapacity = 100;
    private int maxConcurrentRuns = 2;
    private int runHistoryLimit = 100;
    private String defaultVoiceId = "pNInz6obpgDQGcFmaJgB";
    private int defaultVideoDurationSeconds = 5;
    private Pricing pricing = new Pricing();

    public Stage getImages() {
        return images;
    }

    public void setImages(Stage images) {
        this.images = images;
    }

    public Stage getAudio() {
        return audio;
    }

    public void setAudio(Stage audio) {
        this.audio = audio;
    }

    public Stage getVideos() {
        return videos;
    }

    public void setVideos(Stage videos) {
        this.videos = videos;
    }

    public long getRetryBaseDelayMs() {
        return retryBaseDelayMs;
    }

    public void setRetryBaseDelayMs(long retryBaseDelayMs) {
        this.retryBaseDelayMs = retryBaseDelayMs;
    }

    public int getDefaultBatchSize() {
        return defaultBatchSize;
    }

    public void setDefaultBatchSize(int defaultBatchSize) {
        this.defaultBatchSize = defaultBatchSize;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public void setDefaultMaxRetries(int defaultMaxRetries) {
        this.defaultMaxRetries = defaultMaxRetries;
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

    public int getMaxConcurrentRuns() {
        return maxConcurrentRuns;
    }

    public void setMaxConcurrentRuns(int maxConcurrentRuns) {
        this.maxConcurrentRuns = maxConcurrentRuns;
    }

    public int getRunHistoryLimit() {
        return runHistoryLimit;
    }

    public void setRunHistoryLimit(int runHistoryLimit) {
        this.runHistoryLimit = runHistoryLimit;
    }

    public String getDefaultVoiceId() {
        return defaultVoiceId;
    }

    public void setDefaultVoiceId(String defaultVoiceId) {
        this.defaultVoiceId = defaultVoiceId;
    }

    public int getDefaultVideoDurationSeconds() {
        return defaultVideoDurationSeconds;
    }

    public void setDefaultVideoDurationSeconds(int defaultVideoDurationSeconds) {
        this.defaultVideoDurationSeconds = defaultVideoDurationSeconds;
    }

    public Pricing getPricing() {
        return pricing;
    }

    public void setPricing(Pricing pricing) {
        this.pricing = pricing;
    }

    public static class Stage {
        private String model;
        private String provider;
        private double similarityThreshold;
        private long interBatchDelayMs;

        public Stage() {
        }

        public Stage(String model, String provider, double similarityThreshold, long interBatchDelayMs) {
            this.model = model;
            this.provider = provider;
            this.similarityThreshold = similarityThreshold;
            this.interBatchDelayMs = interBatchDelayMs;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }

        public long getInterBatchDelayMs() {
            return interBatchDelayMs;
        }

        public void setInterBatchDelayMs(long interBatchDelayMs) {
            this.interBatchDelayMs = interBatchDelayMs;
        }
    }

    public static class Pricing {
        private double imagePerCall = 0.04;
        private double audioPerCharacter = 0.0005;
        private double videoPerSecond = 0.05;

        public double getImagePerCall() {
            return imagePerCall;
        }

        public void setImagePerCall(double imagePerCall) {
            this.imagePerCall = imagePerCall;
        }

        public double getAudioPerCharacter() {
            return audioPerCharacter;
        }

        public void setAudioPerCharacter(double audioPerCharacter) {
            this.audioPerCharacter = audioPerCharacter;
        }

        public double getVideoPerSecond() {
            return videoPerSecond;
        }

        public void setVideoPerSecond(double videoPerSecond) {
            this.videoPerSecond = videoPerSecond;
        }
    }
}
