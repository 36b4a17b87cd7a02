package com.example.mediagen_backend.service.scheduler;

import com.example.mediagen_backend.config.SchedulerProperties;
import com.example.mediagen_backend.model.Job;
import com.example.mediagen_backend.model.JobResult;
import com.example.mediagen_backend.util.JobPriority;
import com.example.mediagen_backend.util.JobStatus;
import com.example.mediagen_backend.util.JobType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BatchSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private SchedulerProperties properties;
    private JobQueue queue;
    private TaskScheduler retryScheduler;
    private final List<Instant> retryTimes = new ArrayList<>();
    private final List<SchedulerEvent> events = new ArrayList<>();
    private BatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new SchedulerProperties();
        properties.setMaxConcurrentJobs(5);
        properties.setMaxBatchSize(10);
        properties.setRetryDelayMs(1000);
        properties.setDefaultMaxRetries(3);
        properties.setMaxMemoryMb(2048);
        properties.setMaxCostPerHour(50);
        queue = new JobQueue(100);
        retryScheduler = mock(TaskScheduler.class);
        when(retryScheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(inv -> {
            retryTimes.add(inv.getArgument(1));
            ((Runnable) inv.getArgument(0)).run();
            return null;
        });
    }

    private BatchScheduler newScheduler(Executor executor) {
        scheduler = new BatchScheduler(queue, properties, new MemoryEstimator(new ObjectMapper()), executor,
                retryScheduler, Clock.fixed(T0, ZoneOffset.UTC), new InMemoryJobHistoryStore(100),
                List.of(events::add));
        return scheduler;
    }

    private static JobSubmission submission(JobType type, JobPriority priority, Set<String> deps) {
        return new JobSubmission(type, priority, Map.of(), null, deps, null, null);
    }

    private static BatchProcessor succeeding(List<Job> seen) {
        return jobs -> {
            seen.addAll(jobs);
            return jobs.stream()
                    .map(j -> JobResult.ok(Map.of("url", "u-" + j.getId()), Duration.ofMillis(5), 1.0))
                    .toList();
        };
    }

    private List<SchedulerEvent.Type> eventTypes() {
        return events.stream().map(SchedulerEvent::type).toList();
    }

    @Test
    void dependentJobRunsOnlyAfterItsDependencyCompleted() {
        newScheduler(Runnable::run);
        List<Job> seen = new ArrayList<>();
        scheduler.registerProcessor(JobType.IMAGE, succeeding(seen));
        scheduler.registerProcessor(JobType.VIDEO, succeeding(seen));

        String parent = scheduler.submitJob(submission(JobType.VIDEO, JobPriority.MEDIUM, Set.of()));
        String child = scheduler.submitJob(submission(JobType.IMAGE, JobPriority.HIGH, Set.of(parent)));
        assertThat(scheduler.jobStatus(child).job().getPriority()).isEqualTo(JobPriority.LOW);

        scheduler.tick();

        assertThat(seen).extracting(Job::getId).containsExactly(parent);
        assertThat(scheduler.jobStatus(child).status()).isEqualTo(JobStatus.QUEUED);
        assertThat(scheduler.jobStatus(child).job().getPriority()).isEqualTo(JobPriority.HIGH);

        scheduler.tick();

        assertThat(seen).extracting(Job::getId).containsExactly(parent, child);
        JobQueue.Lookup done = scheduler.jobStatus(child);
        assertThat(done.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(done.job().getResult()).containsEntry("url", "u-" + child);
    }

    @Test
    void transientFailuresRetryWithBackoffAndDemotionUntilExhausted() {
        newScheduler(Runnable::run);
        AtomicInteger calls = new AtomicInteger();
        scheduler.registerProcessor(JobType.IMAGE, jobs -> {
            calls.incrementAndGet();
            return List.of(JobResult.failure("boom", Duration.ZERO));
        });
        String id = scheduler.submitJob(submission(JobType.IMAGE, JobPriority.HIGH, Set.of()));

        scheduler.tick();
        assertThat(scheduler.jobStatus(id).status()).isEqualTo(JobStatus.QUEUED);
        assertThat(scheduler.jobStatus(id).job().getPriority()).isEqualTo(JobPriority.MEDIUM);

        scheduler.tick();
        scheduler.tick();
        scheduler.tick();

        assertThat(calls).hasValue(3);
        JobQueue.Lookup lookup = scheduler.jobStatus(id);
        assertThat(lookup.status()).isEqualTo(JobStatus.FAILED);
        assertThat(lookup.job().getRetryCount()).isEqualTo(3);
        assertThat(lookup.job().getError()).isEqualTo("Max retries exceeded: boom");
        assertThat(lookup.job().getPriority()).isEqualTo(JobPriority.LOW);
        assertThat(retryTimes).containsExactly(T0.plusMillis(1000), T0.plusMillis(2000));
        assertThat(eventTypes()).containsExactly(
                SchedulerEvent.Type.JOB_QUEUED,
                SchedulerEvent.Type.JOB_RETRY, SchedulerEvent.Type.JOB_QUEUED,
                SchedulerEvent.Type.JOB_RETRY, SchedulerEvent.Type.JOB_QUEUED,
                SchedulerEvent.Type.JOB_FAILED);
    }

    @Test
    void jobSucceedingOnRetryCompletesItsWaiter() {
        newScheduler(Runnable::run);
        AtomicBoolean failedOnce = new AtomicBoolean();
        scheduler.registerProcessor(JobType.AUDIO, jobs -> List.of(failedOnce.compareAndSet(false, true)
                ? JobResult.failure("429", Duration.ZERO)
                : JobResult.ok(Map.of("url", "audio.mp3"), Duration.ofMillis(10), 0.2)));
        String id = scheduler.submitJob(submission(JobType.AUDIO, JobPriority.MEDIUM, Set.of()));
        CompletableFuture<Job> waiter = scheduler.awaitJob(id);

        scheduler.tick();
        assertThat(waiter).isNotDone();
        scheduler.tick();

        assertThat(waiter).isCompleted();
        Job done = waiter.join();
        assertThat(done.isFailed()).isFalse();
        assertThat(done.getRetryCount()).isEqualTo(1);
        assertThat(done.getCost()).isEqualTo(0.2);
        assertThat(scheduler.awaitJob(id).join().getId()).isEqualTo(id);
    }

    @Test
    void permanentFailureSkipsRetriesAndFailsDependents() {
        newScheduler(Runnable::run);
        List<Job> videos = new ArrayList<>();
        scheduler.registerProcessor(JobType.IMAGE,
                jobs -> List.of(JobResult.permanentFailure("bad prompt", Duration.ZERO)));
        scheduler.registerProcessor(JobType.VIDEO, succeeding(videos));

        String parent = scheduler.submitJob(submission(JobType.IMAGE, JobPriority.MEDIUM, Set.of()));
        String child = scheduler.submitJob(submission(JobType.VIDEO, JobPriority.MEDIUM, Set.of(parent)));

        scheduler.tick();
        scheduler.tick();

        assertThat(retryTimes).isEmpty();
        assertThat(videos).isEmpty();
        assertThat(scheduler.jobStatus(parent).job().getError()).isEqualTo("bad prompt");
        JobQueue.Lookup dependent = scheduler.jobStatus(child);
        assertThat(dependent.status()).isEqualTo(JobStatus.FAILED);
        assertThat(dependent.job().getError()).isEqualTo("dependency " + parent + " failed");

        String late = scheduler.submitJob(submission(JobType.VIDEO, JobPriority.MEDIUM, Set.of(parent)));
        assertThat(scheduler.jobStatus(late).status()).isEqualTo(JobStatus.FAILED);
        assertThat(scheduler.queueStats().failedJobs()).isEqualTo(3);
    }

    @Test
    void batchesNeverExceedMemoryCeiling() {
        properties.setMaxMemoryMb(120);
        newScheduler(Runnable::run);
        List<Integer> batchSizes = new ArrayList<>();
        List<Long> memoryDuringBatch = new ArrayList<>();
        scheduler.registerProcessor(JobType.IMAGE, jobs -> {
            batchSizes.add(jobs.size());
            memoryDuringBatch.add(scheduler.queueStats().resourceUsage().memoryMb());
            return jobs.stream().map(j -> JobResult.ok(Map.of(), Duration.ZERO, 1.0)).toList();
        });
        for (int i = 0; i < 5; i++) {
            scheduler.submitJob(submission(JobType.IMAGE, JobPriority.MEDIUM, Set.of()));
        }

        scheduler.tick();
        scheduler.tick();
        scheduler.tick();

        assertThat(batchSizes).containsExactly(2, 2, 1);
        assertThat(memoryDuringBatch).allSatisfy(m -> assertThat(m).isLessThanOrEqualTo(120L));
        assertThat(scheduler.queueStats().resourceUsage().memoryMb()).isZero();
        assertThat(scheduler.queueStats().completedJobs()).isEqualTo(5);
    }

    @Test
    void concurrencyCapHoldsWhileBatchesAreInFlightAndAlertsOnPressure() {
        properties.setMaxConcurrentJobs(3);
        properties.setMaxMemoryMb(180);
        List<Runnable> pending = new ArrayList<>();
        newScheduler(pending::add);
        List<Job> seen = new ArrayList<>();
        scheduler.registerProcessor(JobType.IMAGE, succeeding(seen));
        for (int i = 0; i < 5; i++) {
            scheduler.submitJob(submission(JobType.IMAGE, JobPriority.MEDIUM, Set.of()));
        }

        scheduler.tick();
        scheduler.tick();

        assertThat(pending).hasSize(1);
        assertThat(scheduler.queueStats().activeJobs()).isEqualTo(3);
        assertThat(scheduler.queueStats().resourceUsage().memoryMb()).isEqualTo(150);
        assertThat(eventTypes()).contains(SchedulerEvent.Type.RESOURCE_ALERT);

        pending.remove(0).run();
        scheduler.tick();
        pending.remove(0).run();

        assertThat(seen).hasSize(5);
        assertThat(scheduler.queueStats().completedJobs()).isEqualTo(5);
    }

    @Test
    void cancellingQueuedJobFailsItAndItsDependents() {
        newScheduler(Runnable::run);
        List<Job> seen = new ArrayList<>();
        scheduler.registerProcessor(JobType.IMAGE, succeeding(seen));
        String id = scheduler.submitJob(submission(JobType.IMAGE, JobPriority.MEDIUM, Set.of()));
        String dependent = scheduler.submitJob(submission(JobType.IMAGE, JobPriority.MEDIUM, Set.of(id)));

        assertThat(scheduler.cancelJob(id)).isTrue();
        scheduler.tick();

        assertThat(seen).isEmpty();
        assertThat(scheduler.jobStatus(id).job().getError()).isEqualTo("Cancelled by user");
        assertThat(scheduler.jobStatus(dependent).status()).isEqualTo(JobStatus.FAILED);
        assertThat(eventTypes()).contains(SchedulerEvent.Type.JOB_CANCELLED);
        assertThat(scheduler.cancelJob(id)).isFalse();
    }

    @Test
    void cancellingRunningJobDiscardsItsResult() {
        newScheduler(Runnable::run);
        List<Boolean> cancelReturns = new ArrayList<>();
        scheduler.registerProcessor(JobType.VIDEO, jobs -> {
            cancelReturns.add(scheduler.cancelJob(jobs.get(0).getId()));
            return List.of(JobResult.ok(Map.of("url", "v.mp4"), Duration.ZERO, 2.0));
        });
        String id = scheduler.submitJob(submission(JobType.VIDEO, JobPriority.MEDIUM, Set.of()));

        scheduler.tick();

        assertThat(cancelReturns).containsExactly(false);
        JobQueue.Lookup lookup = scheduler.jobStatus(id);
        assertThat(lookup.status()).isEqualTo(JobStatus.FAILED);
        assertThat(lookup.job().getError()).isEqualTo("Cancelled by user");
        assertThat(scheduler.queueStats().completedJobs()).isZero();
        assertThat(scheduler.queueStats().totalCost()).isZero();
    }

    @Test
    void processorExceptionFailsWholeBatch() {
        newScheduler(Runnable::run);
        scheduler.registerProcessor(JobType.AUDIO, jobs -> {
            throw new IllegalStateException("kaput");
        });
        String a = scheduler.submitJob(new JobSubmission(JobType.AUDIO, JobPriority.MEDIUM, Map.of(), 1, Set.of(), null, null));
        String b = scheduler.submitJob(new JobSubmission(JobType.AUDIO, JobPriority.MEDIUM, Map.of(), 1, Set.of(), null, null));

        scheduler.tick();

        assertThat(scheduler.jobStatus(a).job().getError()).isEqualTo("Max retries exceeded: kaput");
        assertThat(scheduler.jobStatus(b).status()).isEqualTo(JobStatus.FAILED);
        assertThat(scheduler.queueStats().resourceUsage().activeConnections()).isZero();
    }

    @Test
    void missingResultIsTreatedAsFailure() {
        newScheduler(Runnable::run);
        scheduler.registerProcessor(JobType.IMAGE, jobs -> List.of());
        String id = scheduler.submitJob(new JobSubmission(JobType.IMAGE, JobPriority.MEDIUM, Map.of(), 1, Set.of(), null, null));

        scheduler.tick();

        assertThat(scheduler.jobStatus(id).job().getError())
                .isEqualTo("Max retries exceeded: No result returned by processor");
    }

    @Test
    void typeWithoutProcessorStaysQueued() {
        newScheduler(Runnable::run);
        String id = scheduler.submitJob(submission(JobType.SCRIPT, JobPriority.MEDIUM, Set.of()));

        scheduler.tick();

        assertThat(scheduler.jobStatus(id).status()).isEqualTo(JobStatus.QUEUED);
        assertThat(scheduler.queueStats().queueSizes()).containsEntry(JobType.SCRIPT, 1);
    }

    @Test
    void unknownJobCannotBeAwaited() {
        newScheduler(Runnable::run);

        assertThat(scheduler.awaitJob("nope")).isCompletedExceptionally();
        assertThat(scheduler.jobStatus("nope").status()).isEqualTo(JobStatus.NOT_FOUND);
    }

    @Test
    void statsAndHistoryReflectFinishedJobs() {
        newScheduler(Runnable::run);
        scheduler.registerProcessor(JobType.IMAGE, succeeding(new ArrayList<>()));
        scheduler.registerProcessor(JobType.AUDIO, jobs -> List.of(JobResult.permanentFailure("no", Duration.ZERO)));
        scheduler.submitJob(submission(JobType.IMAGE, JobPriority.MEDIUM, Set.of()));
        scheduler.submitJob(submission(JobType.AUDIO, JobPriority.MEDIUM, Set.of()));

        scheduler.tick();

        QueueStats stats = scheduler.queueStats();
        assertThat(stats.totalJobs()).isEqualTo(2);
        assertThat(stats.successRate()).isEqualTo(0.5);
        assertThat(stats.totalCost()).isEqualTo(1.0);
        assertThat(stats.queuedJobs()).isZero();
        assertThat(scheduler.history(null, 10)).hasSize(2);
        assertThat(scheduler.history(JobType.AUDIO, 10)).extracting(JobHistoryStore.Entry::status)
                .containsExactly("FAILED");
    }

    @Test
    void backoffDoublesPerRetry() {
        newScheduler(Runnable::run);

        assertThat(scheduler.backoffDelayMs(1)).isEqualTo(1000);
        assertThat(scheduler.backoffDelayMs(2)).isEqualTo(2000);
        assertThat(scheduler.backoffDelayMs(4)).isEqualTo(8000);
    }

    @Test
    void noDispatchAfterShutdown() {
        properties.setShutdownTimeoutMs(100);
        newScheduler(Runnable::run);
        List<Job> seen = new ArrayList<>();
        scheduler.registerProcessor(JobType.IMAGE, succeeding(seen));
        scheduler.submitJob(submission(JobType.IMAGE, JobPriority.MEDIUM, Set.of()));

        scheduler.shutdown();
        scheduler.tick();

        assertThat(seen).isEmpty();
    }

    @Test
    void resultsWithNullValuesCompleteTheWholeBatch() {
        newScheduler(Runnable::run);
        scheduler.registerProcessor(JobType.IMAGE, jobs -> jobs.stream()
                .map(j -> {
                    Map<String, Object> data = new HashMap<>();
                    data.put("url", "u-" + j.getId());
                    data.put("thumbnail", null);
                    return JobResult.ok(data, Duration.ofMillis(5), 1.0);
                })
                .toList());
        String a = scheduler.submitJob(submission(JobType.IMAGE, JobPriority.MEDIUM, Set.of()));
        String b = scheduler.submitJob(submission(JobType.IMAGE, JobPriority.MEDIUM, Set.of()));
        CompletableFuture<Job> waiter = scheduler.awaitJob(a);

        scheduler.tick();

        assertThat(scheduler.jobStatus(a).status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(scheduler.jobStatus(b).status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(scheduler.jobStatus(a).job().getResult()).containsEntry("thumbnail", null);
        assertThat(queue.processingCount()).isZero();
        assertThat(waiter).isCompleted();
    }

    @Test
    void submitAcceptsPayloadWithNullValues() {
        newScheduler(Runnable::run);
        Map<String, Object> data = new HashMap<>();
        data.put("prompt", "a fox");
        data.put("seed", null);

        String id = scheduler.submitJob(JobSubmission.of(JobType.IMAGE, data));

        assertThat(scheduler.jobStatus(id).status()).isEqualTo(JobStatus.QUEUED);
        assertThat(scheduler.jobStatus(id).job().getData()).containsEntry("seed", null);
    }

    @Test
    void retrySchedulingFailureFailsTheJobInsteadOfStrandingIt() {
        retryScheduler = mock(TaskScheduler.class);
        when(retryScheduler.schedule(any(Runnable.class), any(Instant.class)))
                .thenThrow(new TaskRejectedException("retry scheduler shut down"));
        newScheduler(Runnable::run);
        scheduler.registerProcessor(JobType.IMAGE, jobs -> jobs.stream()
                .map(j -> JobResult.failure("503", Duration.ZERO))
                .toList());
        String a = scheduler.submitJob(submission(JobType.IMAGE, JobPriority.MEDIUM, Set.of()));
        String b = scheduler.submitJob(submission(JobType.IMAGE, JobPriority.MEDIUM, Set.of()));

        scheduler.tick();

        assertThat(scheduler.jobStatus(a).status()).isEqualTo(JobStatus.FAILED);
        assertThat(scheduler.jobStatus(b).status()).isEqualTo(JobStatus.FAILED);
        assertThat(scheduler.jobStatus(a).job().getError()).startsWith("Result booking failed");
        assertThat(queue.processingCount()).isZero();
        assertThat(queue.queuedCount()).isZero();
    }

    @Test
    void dependentRunsEvenAfterItsDependencyLeftTheHistory() {
        queue = new JobQueue(1);
        newScheduler(Runnable::run);
        List<Job> seen = new ArrayList<>();
        scheduler.registerProcessor(JobType.IMAGE, succeeding(seen));
        String a = scheduler.submitJob(submission(JobType.IMAGE, JobPriority.MEDIUM, Set.of()));
        scheduler.tick();
        scheduler.submitJob(submission(JobType.IMAGE, JobPriority.MEDIUM, Set.of()));
        scheduler.tick();

        String b = scheduler.submitJob(submission(JobType.IMAGE, JobPriority.HIGH, Set.of(a)));
        assertThat(scheduler.jobStatus(a).status()).isEqualTo(JobStatus.NOT_FOUND);
        scheduler.tick();

        assertThat(scheduler.jobStatus(b).status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(seen).extracting(Job::getId).contains(b);
    }
}
