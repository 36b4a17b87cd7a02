package com.example.mediagen_backend.model;

import com.example.mediagen_backend.util.JobPriority;
import com.example.mediagen_backend.util.JobType;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a unit of generation work. State changes go through
 * {@link JobTransitions#apply(Job, JobEvent)}, which returns a new snapshot.
 */
public final class Job {
    private final String id;
    private final JobType type;
    private final JobPriority priority;
    private final JobPriority requestedPriority;
    private final Map<String, Object> data;
    private final int retryCount;
    private final int maxRetries;
    private final Set<String> dependencies;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant failedAt;
    private final String error;
    private final Duration estimatedDuration;
    private final double costEstimate;
    private final boolean cancelRequested;
    private final Map<String, Object> result;
    private final double cost;

    private Job(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.type = Objects.requireNonNull(b.type, "type");
        this.priority = b.priority == null ? JobPriority.MEDIUM : b.priority;
        this.requestedPriority = b.requestedPriority == null ? this.priority : b.requestedPriority;
        this.data = copyOf(b.data);
        this.retryCount = b.retryCount;
        this.maxRetries = b.maxRetries;
        this.dependencies = b.dependencies == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(b.dependencies));
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt");
        this.startedAt = b.startedAt;
        this.completedAt = b.completedAt;
        this.failedAt = b.failedAt;
        this.error = b.error;
        this.estimatedDuration = b.estimatedDuration;
        this.costEstimate = b.costEstimate;
        this.cancelRequested = b.cancelRequested;
        this.result = copyOf(b.result);
        this.cost = b.cost;
    }

    public String getId() {
        return id;
    }

    public JobType getType() {
        return type;
    }

    public JobPriority getPriority() {
        return priority;
    }

    /**
     * Priority the submitter asked for; restored once pending dependencies clear.
     */
    public JobPriority getRequestedPriority() {
        return requestedPriority;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Set<String> getDependencies() {
        return dependencies;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    public String getError() {
        return error;
    }

    public Duration getEstimatedDuration() {
        return estimatedDuration;
    }

    public double getCostEstimate() {
        return costEstimate;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public double getCost() {
        return cost;
    }

    public boolean isTerminal() {
        return completedAt != null || failedAt != null;
    }

    public boolean isFailed() {
        return failedAt != null;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.id = id;
        b.type = type;
        b.priority = priority;
        b.requestedPriority = requestedPriority;
        b.data = data;
        b.retryCount = retryCount;
        b.maxRetries = maxRetries;
        b.dependencies = dependencies;
        b.createdAt = createdAt;
        b.startedAt = startedAt;
        b.completedAt = completedAt;
        b.failedAt = failedAt;
        b.error = error;
        b.estimatedDuration = estimatedDuration;
        b.costEstimate = costEstimate;
        b.cancelRequested = cancelRequested;
        b.result = result;
        b.cost = cost;
        return b;
    }

    /**
     * Payloads are opaque, so null values are kept.
     */
    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", type=" + type + ", priority=" + priority + ", retryCount=" + retryCount
                + "/" + maxRetries + ", dependencies=" + dependencies + "}";
    }

    public static class Builder {
        private String id;
        private JobType type;
        private JobPriority priority;
        private JobPriority requestedPriority;
        private Map<String, Object> data;
        private int retryCount;
        private int maxRetries = 3;
        private Set<String> dependencies;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private Instant failedAt;
        private String error;
        private Duration estimatedDuration;
        private double costEstimate = 1.0;
        private boolean cancelRequested;
        private Map<String, Object> result;
        private double cost;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(JobType type) {
            this.type = type;
            return this;
        }

        public Builder priority(JobPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder requestedPriority(JobPriority requestedPriority) {
            this.requestedPriority = requestedPriority;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder dependencies(Set<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            this.failedAt = failedAt;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder estimatedDuration(Duration estimatedDuration) {
            this.estimatedDuration = estimatedDuration;
            return this;
        }

        public Builder costEstimate(double costEstimate) {
            this.costEstimate = costEstimate;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder result(Map<String, Object> result) {
            this.result = result;
            return this;
        }

        public Builder cost(double cost) {
            this.cost = cost;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }
}
