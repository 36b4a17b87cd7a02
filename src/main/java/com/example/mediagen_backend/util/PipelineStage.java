package com.example.mediagen_backend.util;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-scene generation stages, in execution order.
 */
public enum PipelineStage {
    IMAGES("images", JobType.IMAGE),
    AUDIO("audio", JobType.AUDIO),
    VIDEOS("videos", JobType.VIDEO);

    private final String label;
    private final JobType jobType;

    PipelineStage(String label, JobType jobType) {
        this.label = label;
        this.jobType = jobType;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public JobType jobType() {
        return jobType;
    }
}
