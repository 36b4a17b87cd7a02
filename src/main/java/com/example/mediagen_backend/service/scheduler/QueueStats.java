package com.example.mediagen_backend.service.scheduler;

import com.example.mediagen_backend.util.JobType;

import java.util.Map;

public record QueueStats(long totalJobs,
                         long completedJobs,
                         long failedJobs,
                         int activeJobs,
                         int queuedJobs,
                         double averageProcessingTimeMs,
                         double totalCost,
                         double successRate,
                         Map<JobType, Integer> queueSizes,
                         double estimatedWaitTimeMs,
                         ResourceUsage resourceUsage) {
}
