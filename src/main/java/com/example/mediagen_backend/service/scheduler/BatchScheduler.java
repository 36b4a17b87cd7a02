package com.example.mediagen_backend.service.scheduler;

import com.example.mediagen_backend.config.SchedulerProperties;
import com.example.mediagen_backend.model.Job;
import com.example.mediagen_backend.model.JobEvent;
import com.example.mediagen_backend.model.JobResult;
import com.example.mediagen_backend.model.JobTransitions;
import com.example.mediagen_backend.util.JobPriority;
import com.example.mediagen_backend.util.JobType;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.stream.Collectors;

/**
 * Tick-driven batch dispatcher. Each tick selects an admissible batch per job type under the
 * concurrency, memory and cost-rate ceilings, hands it to the registered {@link BatchProcessor}
 * on the worker pool and books the results: completion, retry with exponential backoff and
 * priority demotion, or permanent failure.
 */
@Service
public class BatchScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchScheduler.class);
    private static final int MAX_BACKOFF_SHIFT = 20;

    private final JobQueue queue;
    private final SchedulerProperties properties;
    private final MemoryEstimator memoryEstimator;
    private final BatchSelector selector;
    private final ResourceBudget budget = new ResourceBudget();
    private final Object admissionLock = new Object();
    private final Executor workerExecutor;
    private final TaskScheduler retryScheduler;
    private final Clock clock;
    private final JobHistoryStore historyStore;

    private final Map<JobType, BatchProcessor> processors = new ConcurrentHashMap<>();
    private final List<SchedulerEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, CompletableFuture<Job>> waiters = new ConcurrentHashMap<>();

    private final AtomicBoolean ticking = new AtomicBoolean();
    private final AtomicBoolean shuttingDown = new AtomicBoolean();
    private final AtomicInteger inFlightBatches = new AtomicInteger();

    private final AtomicLong totalJobs = new AtomicLong();
    private final AtomicLong completedJobs = new AtomicLong();
    private final AtomicLong failedJobs = new AtomicLong();
    private final AtomicLong processedJobs = new AtomicLong();
    private final AtomicLong totalProcessingMs = new AtomicLong();
    private final DoubleAdder totalCost = new DoubleAdder();

    @Autowired
    public BatchScheduler(JobQueue queue,
                          SchedulerProperties properties,
                          ObjectMapper objectMapper,
                          @Qualifier("workerTaskExecutor") Executor workerExecutor,
                          @Qualifier("retryTaskScheduler") TaskScheduler retryScheduler,
                          Clock clock,
                          JobHistoryStore historyStore,
                          List<SchedulerEventListener> listeners) {
        this(queue, properties, new MemoryEstimator(objectMapper), workerExecutor, retryScheduler, clock,
                historyStore, listeners);
    }

    BatchScheduler(JobQueue queue,
                   SchedulerProperties properties,
                   MemoryEstimator memoryEstimator,
                   Executor workerExecutor,
                   TaskScheduler retryScheduler,
                   Clock clock,
                   JobHistoryStore historyStore,
                   List<SchedulerEventListener> listeners) {
        this.queue = queue;
        this.properties = properties;
        this.memoryEstimator = memoryEstimator;
        this.selector = new BatchSelector(memoryEstimator::estimateMb, properties.getMaxMemoryMb(),
                properties.getMaxCostPerHour(), properties.isEnableOpportunisticFill());
        this.workerExecutor = workerExecutor;
        this.retryScheduler = retryScheduler;
        this.clock = clock;
        this.historyStore = historyStore;
        this.listeners.addAll(listeners);
    }

    public void registerProcessor(JobType type, BatchProcessor processor) {
        processors.put(type, processor);
        LOGGER.info("Scheduler processor registered type={}", type);
    }

    public void addListener(SchedulerEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SchedulerEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Queues a job and returns its generated id. A job whose dependencies are still pending is
     * queued at low priority until they clear; one whose dependency already failed is failed
     * immediately.
     */
    public String submitJob(JobSubmission submission) {
        if (submission == null || submission.type() == null) {
            throw new IllegalArgumentException("job type is required");
        }
        JobPriority priority = submission.priority() == null ? JobPriority.MEDIUM : submission.priority();
        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .type(submission.type())
                .priority(priority)
                .requestedPriority(priority)
                .data(submission.data())
                .maxRetries(submission.maxRetries() == null ? properties.getDefaultMaxRetries() : submission.maxRetries())
                .dependencies(submission.dependencies())
                .createdAt(clock.instant())
                .estimatedDuration(submission.estimatedDuration())
                .costEstimate(submission.costEstimate() == null ? 1.0 : submission.costEstimate())
                .build();
        totalJobs.incrementAndGet();

        JobQueue.Admission admission = queue.admit(job);
        if (admission.rejected()) {
            LOGGER.warn("Job rejected at submit jobId={} type={} failedDependency={}", job.getId(), job.getType(),
                    admission.failedDependency());
            failPermanently(job, "dependency " + admission.failedDependency() + " failed");
            return job.getId();
        }
        job = admission.queued();
        LOGGER.debug("Job queued jobId={} type={} priority={} deps={}", job.getId(), job.getType(),
                job.getPriority(), job.getDependencies().size());
        publish(SchedulerEvent.of(SchedulerEvent.Type.JOB_QUEUED, job, clock.instant()));
        return job.getId();
    }

    public List<String> submitBatch(List<JobSubmission> submissions) {
        List<String> ids = new ArrayList<>(submissions.size());
        for (JobSubmission submission : submissions) {
            ids.add(submitJob(submission));
        }
        return ids;
    }

    /**
     * Removes a queued (or backoff-parked) job and returns true. An in-flight job only gets its
     * cooperative cancellation flag; its result will be discarded and false is returned.
     */
    public boolean cancelJob(String jobId) {
        JobQueue.Lookup before = queue.status(jobId);
        JobQueue.CancelOutcome outcome = queue.cancel(jobId);
        switch (outcome) {
            case REMOVED -> {
                Job cancelled = JobTransitions.apply(before.job(), JobEvent.failed(clock.instant(), "Cancelled by user"));
                LOGGER.info("Job cancelled jobId={} type={}", jobId, cancelled.getType());
                finishFailed(cancelled, SchedulerEvent.Type.JOB_CANCELLED);
                return true;
            }
            case FLAGGED -> {
                LOGGER.info("Job cancellation requested while running jobId={}", jobId);
                return false;
            }
            default -> {
                return false;
            }
        }
    }

    public JobQueue.Lookup jobStatus(String jobId) {
        return queue.status(jobId);
    }

    /**
     * Future completed with the terminal snapshot of the job (completed or failed).
     */
    public CompletableFuture<Job> awaitJob(String jobId) {
        Optional<Job> done = queue.finishedJob(jobId);
        if (done.isPresent()) {
            return CompletableFuture.completedFuture(done.get());
        }
        if (queue.status(jobId).job() == null) {
            return CompletableFuture.failedFuture(new NoSuchElementException("unknown job " + jobId));
        }
        CompletableFuture<Job> future = waiters.computeIfAbsent(jobId, id -> new CompletableFuture<>());
        queue.finishedJob(jobId).ifPresent(job -> completeWaiter(job));
        return future;
    }

    public List<JobHistoryStore.Entry> history(JobType type, int limit) {
        return historyStore.recent(type, limit);
    }

    public QueueStats queueStats() {
        long completed = completedJobs.get();
        long failed = failedJobs.get();
        long processed = processedJobs.get();
        double avg = processed == 0 ? 0 : (double) totalProcessingMs.get() / processed;
        int queued = queue.queuedCount();
        double successRate = completed + failed == 0 ? 0 : (double) completed / (completed + failed);
        double wait = avg * ((double) queued / Math.max(1, properties.getMaxConcurrentJobs()));
        return new QueueStats(totalJobs.get(), completed, failed, queue.processingCount(), queued, avg,
                totalCost.sum(), successRate, queue.queueSizes(), wait, budget.snapshot());
    }

    @Scheduled(fixedDelayString = "${scheduler.tick-interval-ms:5000}")
    public void tick() {
        if (shuttingDown.get() || !ticking.compareAndSet(false, true)) {
            return;
        }
        try {
            for (JobType type : JobType.values()) {
                BatchProcessor processor = processors.get(type);
                if (processor == null) {
                    if (queue.hasQueued(type)) {
                        LOGGER.warn("Scheduler tick skipped type={} reason=no_processor", type);
                    }
                    continue;
                }
                dispatch(type, processor);
            }
            checkResources();
        } finally {
            ticking.set(false);
        }
    }

    private void dispatch(JobType type, BatchProcessor processor) {
        int slots = Math.min(properties.getMaxConcurrentJobs() - queue.processingCount(), properties.getMaxBatchSize());
        if (slots <= 0) {
            return;
        }
        List<Job> started;
        ResourceBudget.Reservation reservation;
        synchronized (admissionLock) {
            List<Job> candidates = queue.runnableCandidates(type);
            if (candidates.isEmpty()) {
                return;
            }
            List<Job> selected = selector.select(candidates, slots, budget.snapshot());
            if (selected.isEmpty()) {
                LOGGER.debug("Scheduler deferred type={} candidates={} reason=resources", type, candidates.size());
                return;
            }
            started = queue.markProcessing(selected, clock.instant());
            if (started.isEmpty()) {
                return;
            }
            long memory = started.stream().mapToLong(memoryEstimator::estimateMb).sum();
            double cost = started.stream().mapToDouble(BatchSelector::costOf).sum();
            reservation = budget.reserve(memory, cost, started.size());
        }

        LOGGER.info("Batch dispatch type={} size={} ids={}", type, started.size(),
                started.stream().map(Job::getId).collect(Collectors.toList()));
        inFlightBatches.incrementAndGet();
        try {
            workerExecutor.execute(() -> runBatch(type, processor, started, reservation));
        } catch (RejectedExecutionException e) {
            LOGGER.error("Batch rejected by executor type={} size={}: {}", type, started.size(), e.toString());
            budget.release(reservation);
            inFlightBatches.decrementAndGet();
            handleResults(started, failAll(started, "Executor rejected batch: " + e.getMessage(), Duration.ZERO));
        }
    }

    private void runBatch(JobType type, BatchProcessor processor, List<Job> jobs, ResourceBudget.Reservation reservation) {
        long t0 = System.nanoTime();
        try {
            List<JobResult> results;
            try {
                results = processor.process(jobs);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                LOGGER.error("Batch processor failed type={} size={}: {}", type, jobs.size(), e.toString(), e);
                results = failAll(jobs, e.getMessage() == null ? e.toString() : e.getMessage(),
                        Duration.ofNanos(System.nanoTime() - t0));
            } finally {
                budget.release(reservation);
            }
            handleResults(jobs, results);
            LOGGER.info("Batch done type={} size={} in={}ms", type, jobs.size(), (System.nanoTime() - t0) / 1_000_000);
        } finally {
            inFlightBatches.decrementAndGet();
        }
    }

    private static List<JobResult> failAll(List<Job> jobs, String error, Duration duration) {
        List<JobResult> results = new ArrayList<>(jobs.size());
        for (int i = 0; i < jobs.size(); i++) {
            results.add(JobResult.failure(error, duration));
        }
        return results;
    }

    private void handleResults(List<Job> jobs, List<JobResult> results) {
        for (int i = 0; i < jobs.size(); i++) {
            JobResult result = results != null && i < results.size() && results.get(i) != null
                    ? results.get(i)
                    : JobResult.failure("No result returned by processor", Duration.ZERO);
            Job job = jobs.get(i);
            try {
                handleResult(job, result);
            } catch (RuntimeException e) {
                LOGGER.error("Job result booking failed jobId={} type={}: {}", job.getId(), job.getType(), e.toString(), e);
                bookFailure(job, "Result booking failed: " + e);
            }
        }
    }

    /**
     * Fails a job whose result could not be booked, unless it already reached a terminal state.
     */
    private void bookFailure(Job job, String error) {
        queue.completeProcessing(job.getId());
        queue.cancel(job.getId());
        Optional<Job> finished = queue.finishedJob(job.getId());
        if (finished.isPresent()) {
            completeWaiter(finished.get());
            return;
        }
        failPermanently(job, error);
    }

    private void handleResult(Job dispatched, JobResult result) {
        Job current = queue.completeProcessing(dispatched.getId()).orElse(dispatched);
        Instant now = clock.instant();
        recordProcessingTime(current, now);

        if (current.isCancelRequested()) {
            Job cancelled = JobTransitions.apply(current, JobEvent.failed(now, "Cancelled by user"));
            LOGGER.info("Job result discarded jobId={} reason=cancelled", current.getId());
            finishFailed(cancelled, SchedulerEvent.Type.JOB_CANCELLED);
            return;
        }

        if (result.success()) {
            Job done = JobTransitions.apply(current, JobEvent.succeeded(now, result.data(), result.cost()));
            queue.recordFinished(done);
            completedJobs.incrementAndGet();
            totalCost.add(result.cost());
            List<Job> restored = queue.restoreSatisfiedDependents(done.getId());
            LOGGER.info("JOB DONE jobId={} type={} retries={} cost={} unblocked={}", done.getId(), done.getType(),
                    done.getRetryCount(), result.cost(), restored.size());
            record(done);
            publish(SchedulerEvent.of(SchedulerEvent.Type.JOB_COMPLETED, done, now));
            completeWaiter(done);
            return;
        }

        String error = result.error() == null ? "Unknown error" : result.error();
        Job attempted = JobTransitions.apply(current, JobEvent.attemptFailed(error));
        if (!result.permanent() && attempted.getRetryCount() < attempted.getMaxRetries()) {
            long delay = backoffDelayMs(attempted.getRetryCount());
            queue.park(attempted);
            LOGGER.warn("Job retry scheduled jobId={} type={} attempt={}/{} delayMs={} error={}", attempted.getId(),
                    attempted.getType(), attempted.getRetryCount(), attempted.getMaxRetries(), delay, error);
            publish(new SchedulerEvent(SchedulerEvent.Type.JOB_RETRY, attempted, error, Map.of("delayMs", delay), now));
            retryScheduler.schedule(() -> requeue(attempted), now.plusMillis(delay));
            return;
        }
        failPermanently(attempted, result.permanent() ? error : "Max retries exceeded: " + error);
    }

    long backoffDelayMs(int retryCount) {
        int shift = Math.min(Math.max(0, retryCount - 1), MAX_BACKOFF_SHIFT);
        return properties.getRetryDelayMs() * (1L << shift);
    }

    private void requeue(Job attempted) {
        Job requeued = JobTransitions.apply(attempted, JobEvent.requeued());
        if (queue.unpark(attempted.getId(), requeued)) {
            LOGGER.debug("Job requeued jobId={} priority={}", requeued.getId(), requeued.getPriority());
            publish(SchedulerEvent.of(SchedulerEvent.Type.JOB_QUEUED, requeued, clock.instant()));
        }
    }

    private void failPermanently(Job job, String error) {
        Job failed = JobTransitions.apply(job, JobEvent.failed(clock.instant(), error));
        LOGGER.warn("JOB FAILED jobId={} type={} retries={} error={}", failed.getId(), failed.getType(),
                failed.getRetryCount(), failed.getError());
        finishFailed(failed, SchedulerEvent.Type.JOB_FAILED);
    }

    private void finishFailed(Job failed, SchedulerEvent.Type eventType) {
        queue.recordFinished(failed);
        failedJobs.incrementAndGet();
        record(failed);
        publish(new SchedulerEvent(eventType, failed, failed.getError(), Map.of(), clock.instant()));
        completeWaiter(failed);
        for (Job dependent : queue.removeDependentsOf(failed.getId())) {
            failPermanently(dependent, "dependency " + failed.getId() + " failed");
        }
    }

    private void recordProcessingTime(Job job, Instant now) {
        if (job.getStartedAt() != null) {
            processedJobs.incrementAndGet();
            totalProcessingMs.addAndGet(Math.max(0, Duration.between(job.getStartedAt(), now).toMillis()));
        }
    }

    private void record(Job job) {
        try {
            historyStore.record(job);
        } catch (RuntimeException e) {
            LOGGER.warn("Job history write failed jobId={} err={}", job.getId(), e.toString());
        }
    }

    private void completeWaiter(Job job) {
        CompletableFuture<Job> future = waiters.remove(job.getId());
        if (future != null) {
            future.complete(job);
        }
    }

    private void checkResources() {
        ResourceUsage usage = budget.snapshot();
        double threshold = properties.getResourceAlertThreshold();
        double memoryRatio = (double) usage.memoryMb() / Math.max(1, properties.getMaxMemoryMb());
        double costRatio = usage.costPerHour() / Math.max(Double.MIN_VALUE, properties.getMaxCostPerHour());
        if (memoryRatio > threshold || costRatio > threshold) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("memoryMb", usage.memoryMb());
            details.put("memoryRatio", memoryRatio);
            details.put("costPerHour", usage.costPerHour());
            details.put("costRatio", costRatio);
            details.put("activeConnections", usage.activeConnections());
            publish(new SchedulerEvent(SchedulerEvent.Type.RESOURCE_ALERT, null, null, details, clock.instant()));
        }
    }

    private void publish(SchedulerEvent event) {
        for (SchedulerEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOGGER.warn("Scheduler listener failed event={} listener={} err={}", event.type(),
                        listener.getClass().getSimpleName(), e.toString());
            }
        }
    }

    /**
     * Stops dispatching, waits for in-flight batches up to the configured timeout and flags
     * whatever is still running for cancellation.
     */
    @PreDestroy
    public void shutdown() {
        shuttingDown.set(true);
        long deadline = System.currentTimeMillis() + properties.getShutdownTimeoutMs();
        while (inFlightBatches.get() > 0 && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        List<Job> remaining = queue.processingSnapshot();
        remaining.forEach(job -> queue.cancel(job.getId()));
        LOGGER.info("Scheduler stopped inFlightBatches={} flaggedJobs={} queued={}", inFlightBatches.get(),
                remaining.size(), queue.queuedCount());
    }
}
