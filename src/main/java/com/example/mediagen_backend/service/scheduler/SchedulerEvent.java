package com.example.mediagen_backend.service.scheduler;

import com.example.mediagen_backend.model.Job;

import java.time.Instant;
import java.util.Map;

public record SchedulerEvent(Type type, Job job, String error, Map<String, Object> details, Instant at) {

    public enum Type {
        JOB_QUEUED,
        JOB_COMPLETED,
        JOB_RETRY,
        JOB_FAILED,
        JOB_CANCELLED,
        RESOURCE_ALERT
    }

    public static SchedulerEvent of(Type type, Job job, Instant at) {
        return new SchedulerEvent(type, job, null, Map.of(), at);
    }
}
