package com.example.mediagen_backend.service.scheduler;

import com.example.mediagen_backend.util.JobPriority;
import com.example.mediagen_backend.util.JobType;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Caller-supplied part of a job; id, createdAt and retryCount are assigned on submit.
 * Null fields fall back to scheduler defaults.
 */
public record JobSubmission(JobType type,
                            JobPriority priority,
                            Map<String, Object> data,
                            Integer maxRetries,
                            Set<String> dependencies,
                            Duration estimatedDuration,
                            Double costEstimate) {

    public static JobSubmission of(JobType type, Map<String, Object> data) {
        return new JobSubmission(type, JobPriority.MEDIUM, data, null, Set.of(), null, null);
    }
}
