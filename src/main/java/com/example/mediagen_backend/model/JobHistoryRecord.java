package com.example.mediagen_backend.model;

import com.example.mediagen_backend.util.JobType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Terminal job kept for analytics and dependency audits after it leaves the in-memory history.
 */
@Entity
@Table(
        name = "job_history",
        indexes = {
                @Index(name = "idx_job_history_type_finished", columnList = "type, finished_at")
        }
)
public class JobHistoryRecord {
    @Id
    @Column(name = "job_id", nullable = false, updatable = false, length = 64)
    private String jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 16)
    private JobType type;

    @Column(name = "status", nullable = false, length = 16)
    private String status;

    @Column(name = "priority", nullable = false, length = 16)
    private String priority;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Column(name = "cost", nullable = false)
    private double cost;

    @Column(name = "error", length = 2000)
    private String error;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    protected JobHistoryRecord() {
    }

    public JobHistoryRecord(String jobId, JobType type, String status, String priority, int retryCount,
                            int maxRetries, double cost, String error, Instant createdAt, Instant finishedAt) {
        this.jobId = jobId;
        this.type = type;
        this.status = status;
        this.priority = priority;
        this.retryCount = retryCount;
        this.maxRetries = maxRetries;
        this.cost = cost;
        this.error = error;
        this.createdAt = createdAt;
        this.finishedAt = finishedAt;
    }

    public String getJobId() {
        return jobId;
    }

    public JobType getType() {
        return type;
    }

    public String getStatus() {
        return status;
    }

    public String getPriority() {
        return priority;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public double getCost() {
        return cost;
    }

    public String getError() {
        return error;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }
}
