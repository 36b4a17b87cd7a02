package com.example.mediagen_backend.controller;

import com.example.mediagen_backend.model.Job;
import com.example.mediagen_backend.service.scheduler.BatchScheduler;
import com.example.mediagen_backend.service.scheduler.JobHistoryStore;
import com.example.mediagen_backend.service.scheduler.JobQueue;
import com.example.mediagen_backend.service.scheduler.JobSubmission;
import com.example.mediagen_backend.service.scheduler.QueueStats;
import com.example.mediagen_backend.util.JobPriority;
import com.example.mediagen_backend.util.JobStatus;
import com.example.mediagen_backend.util.JobType;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/v1/jobs")
public class JobsController {
    private final BatchScheduler scheduler;

    public JobsController(BatchScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public record SubmitReq(String type,
                            String priority,
                            Map<String, Object> data,
                            Integer maxRetries,
                            Set<String> dependencies,
                            Long estimatedDurationMs,
                            Double costEstimate) {}
    public record SubmitRes(String jobId) {}
    public record BatchRes(List<String> jobIds) {}
    public record CancelRes(String jobId, boolean removed, String status) {}
    public record JobRes(
            String id,
            String type,
            String status,
            String priority,
            int retryCount,
            int maxRetries,
            Set<String> dependencies,
            Map<String, Object> result,
            String error,
            double cost,
            Instant createdAt,
            Instant startedAt,
            Instant completedAt,
            Instant failedAt
    ) {}

    @PostMapping
    public SubmitRes submit(@RequestBody SubmitReq req) {
        return new SubmitRes(scheduler.submitJob(toSubmission(req)));
    }

    @PostMapping("/batch")
    public BatchRes submitBatch(@RequestBody List<SubmitReq> reqs) {
        if (reqs == null || reqs.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "JOBS_REQUIRED");
        }
        return new BatchRes(scheduler.submitBatch(reqs.stream().map(this::toSubmission).toList()));
    }

    @GetMapping("/{id}")
    public JobRes get(@PathVariable String id) {
        JobQueue.Lookup lookup = scheduler.jobStatus(id);
        if (lookup.status() == JobStatus.NOT_FOUND) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND");
        }
        Job j = lookup.job();
        return new JobRes(
                j.getId(),
                j.getType().name(),
                lookup.status().name(),
                j.getPriority().name(),
                j.getRetryCount(),
                j.getMaxRetries(),
                j.getDependencies(),
                j.getResult(),
                j.getError(),
                j.getCost(),
                j.getCreatedAt(),
                j.getStartedAt(),
                j.getCompletedAt(),
                j.getFailedAt()
        );
    }

    @DeleteMapping("/{id}")
    public CancelRes cancel(@PathVariable String id) {
        if (scheduler.jobStatus(id).status() == JobStatus.NOT_FOUND) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND");
        }
        boolean removed = scheduler.cancelJob(id);
        return new CancelRes(id, removed, scheduler.jobStatus(id).status().name());
    }

    @GetMapping("/stats")
    public QueueStats stats() {
        return scheduler.queueStats();
    }

    @GetMapping("/history")
    public List<JobHistoryStore.Entry> history(@RequestParam(required = false) String type,
                                               @RequestParam(defaultValue = "50") int limit) {
        JobType t = type == null || type.isBlank() ? null : parseType(type);
        return scheduler.history(t, Math.min(Math.max(limit, 1), 500));
    }

    private JobSubmission toSubmission(SubmitReq req) {
        if (req == null || req.type() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "TYPE_REQUIRED");
        }
        JobType t = parseType(req.type());
        JobPriority p;
        try {
            p = req.priority() == null ? JobPriority.MEDIUM : JobPriority.valueOf(req.priority().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNKNOWN_PRIORITY");
        }
        if (req.maxRetries() != null && req.maxRetries() < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "MAX_RETRIES_INVALID");
        }
        return new JobSubmission(
                t,
                p,
                req.data() == null ? Map.of() : req.data(),
                req.maxRetries(),
                req.dependencies() == null ? Set.of() : req.dependencies(),
                req.estimatedDurationMs() == null ? null : Duration.ofMillis(req.estimatedDurationMs()),
                req.costEstimate()
        );
    }

    private static JobType parseType(String raw) {
        try {
            return JobType.parse(raw);
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNKNOWN_JOB_TYPE");
        }
    }
}
