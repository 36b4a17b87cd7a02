package com.example.mediagen_backend.model;

import com.example.mediagen_backend.util.JobPriority;

/**
 * Pure state transition function for {@link Job}. Never mutates its input.
 */
public final class JobTransitions {

    private JobTransitions() {
    }

    public static Job apply(Job job, JobEvent event) {
        return switch (event.type()) {
            case DEPENDENCIES_PENDING -> job.getPriority() == JobPriority.LOW
                    ? job
                    : job.toBuilder().priority(JobPriority.LOW).build();
            case DEPENDENCIES_SATISFIED -> job.getPriority() == job.getRequestedPriority()
                    ? job
                    : job.toBuilder().priority(job.getRequestedPriority()).build();
            case STARTED -> job.toBuilder().startedAt(event.at()).build();
            case SUCCEEDED -> job.toBuilder()
                    .completedAt(event.at())
                    .error(null)
                    .result(event.result())
                    .cost(event.cost())
                    .build();
            case ATTEMPT_FAILED -> job.toBuilder()
                    .retryCount(job.getRetryCount() + 1)
                    .error(event.error())
                    .build();
            case REQUEUED -> job.toBuilder()
                    .priority(job.getPriority().demote())
                    .startedAt(null)
                    .build();
            case FAILED -> job.toBuilder()
                    .failedAt(event.at())
                    .error(event.error() == null ? "Max retries exceeded" : event.error())
                    .build();
            case CANCEL_REQUESTED -> job.toBuilder()
                    .cancelRequested(true)
                    .error(event.error())
                    .build();
        };
    }
}
