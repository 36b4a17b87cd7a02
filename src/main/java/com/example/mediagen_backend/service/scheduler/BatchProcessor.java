package com.example.mediagen_backend.service.scheduler;

import com.example.mediagen_backend.model.Job;
import com.example.mediagen_backend.model.JobResult;

import java.util.List;

/**
 * Runs one batch of same-typed jobs and returns one result per job, in the same order.
 * Throwing fails every job in the batch.
 */
@FunctionalInterface
public interface BatchProcessor {
    List<JobResult> process(List<Job> jobs) throws Exception;
}
