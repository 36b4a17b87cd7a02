package com.example.mediagen_backend.service.scheduler;

import com.example.mediagen_backend.model.Job;
import com.example.mediagen_backend.util.JobType;

import java.time.Instant;
import java.util.List;

/**
 * Persistence port for terminal jobs. The scheduler only needs its in-memory history; a store
 * keeps an analytics trail beyond that.
 */
public interface JobHistoryStore {

    record Entry(String jobId,
                 JobType type,
                 String status,
                 String priority,
                 int retryCount,
                 int maxRetries,
                 double cost,
                 String error,
                 Instant createdAt,
                 Instant finishedAt) {

        public static Entry from(Job job) {
            return new Entry(
                    job.getId(),
                    job.getType(),
                    job.isFailed() ? "FAILED" : "COMPLETED",
                    job.getPriority().name(),
                    job.getRetryCount(),
                    job.getMaxRetries(),
                    job.getCost(),
                    job.getError(),
                    job.getCreatedAt(),
                    job.isFailed() ? job.getFailedAt() : job.getCompletedAt());
        }
    }

    void record(Job job);

    List<Entry> recent(JobType type, int limit);
}
