package com.example.mediagen_backend.service.scheduler;

import com.example.mediagen_backend.config.SchedulerProperties;
import com.example.mediagen_backend.model.Job;
import com.example.mediagen_backend.model.JobEvent;
import com.example.mediagen_backend.model.JobTransitions;
import com.example.mediagen_backend.util.JobStatus;
import com.example.mediagen_backend.util.JobType;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-type priority queues plus the in-flight and finished bookkeeping used for dependency
 * checks and status lookups. All methods synchronize on the instance.
 */
@Component
public class JobQueue {

    static final Comparator<Job> QUEUE_ORDER = Comparator
            .comparingInt((Job j) -> j.getPriority().weight()).reversed()
            .thenComparing(Job::getCreatedAt);

    public enum CancelOutcome {
        REMOVED,
        FLAGGED,
        NOT_CANCELLABLE
    }

    /**
     * Outcome of {@link #admit(Job)}: either the queued snapshot or the dependency that already failed.
     */
    public record Admission(Job queued, String failedDependency) {
        public boolean rejected() {
            return failedDependency != null;
        }
    }

    public record Lookup(JobStatus status, Job job) {
        public Optional<Job> jobIfPresent() {
            return Optional.ofNullable(job);
        }
    }

    private final Map<JobType, List<Job>> queues = new EnumMap<>(JobType.class);
    private final Map<String, Job> delayed = new HashMap<>();
    private final Map<String, Job> processing = new LinkedHashMap<>();
    private final Map<String, Job> finished;
    // Terminal outcome per job id (true = failed). Unbounded, unlike finished.
    private final Map<String, Boolean> outcomes = new HashMap<>();

    public JobQueue(SchedulerProperties properties) {
        this(properties.getHistoryLimit());
    }

    JobQueue(int historyLimit) {
        int limit = Math.max(1, historyLimit);
        this.finished = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Job> eldest) {
                return size() > limit;
            }
        };
    }

    /**
     * Inserts the job and re-sorts its type queue by priority weight desc, createdAt asc.
     * Duplicate ids are not rejected.
     */
    public synchronized void enqueue(Job job) {
        delayed.remove(job.getId());
        List<Job> queue = queues.computeIfAbsent(job.getType(), t -> new ArrayList<>());
        queue.add(job);
        queue.sort(QUEUE_ORDER);
    }

    /**
     * Dependency check, demotion and insert in one step, so a dependency failing concurrently
     * either rejects the job here or finds it queued when its dependents are removed.
     */
    public synchronized Admission admit(Job job) {
        Optional<String> failed = failedDependency(job);
        if (failed.isPresent()) {
            return new Admission(null, failed.get());
        }
        Job queued = dependenciesSatisfied(job) ? job : JobTransitions.apply(job, JobEvent.dependenciesPending());
        enqueue(queued);
        return new Admission(queued, null);
    }

    /**
     * Parks a job that is waiting out a retry backoff. It reports as queued meanwhile.
     */
    public synchronized void park(Job job) {
        delayed.put(job.getId(), job);
    }

    /**
     * Moves a parked job back into its queue. Returns false if it was cancelled while parked.
     */
    public synchronized boolean unpark(String jobId, Job requeued) {
        if (delayed.remove(jobId) == null) {
            return false;
        }
        enqueue(requeued);
        return true;
    }

    /**
     * Up to {@code limit} runnable jobs of the given type in queue order. Jobs whose
     * dependencies are not yet completed are skipped but stay queued.
     */
    public synchronized List<Job> dequeueCandidates(JobType type, int limit) {
        List<Job> out = new ArrayList<>();
        for (Job job : queues.getOrDefault(type, List.of())) {
            if (out.size() >= limit) {
                break;
            }
            if (dependenciesSatisfied(job)) {
                out.add(job);
            }
        }
        return out;
    }

    public synchronized List<Job> runnableCandidates(JobType type) {
        return dequeueCandidates(type, Integer.MAX_VALUE);
    }

    public synchronized boolean dependenciesSatisfied(Job job) {
        for (String dep : job.getDependencies()) {
            if (!Boolean.FALSE.equals(outcomes.get(dep))) {
                return false;
            }
        }
        return true;
    }

    public synchronized Optional<String> failedDependency(Job job) {
        return job.getDependencies().stream()
                .filter(dep -> Boolean.TRUE.equals(outcomes.get(dep)))
                .findFirst();
    }

    /**
     * Removes the given jobs from their queue and registers them as in flight. Jobs no longer
     * queued (cancelled concurrently) are left out of the returned list.
     */
    public synchronized List<Job> markProcessing(List<Job> selected, Instant now) {
        List<Job> started = new ArrayList<>(selected.size());
        for (Job job : selected) {
            List<Job> queue = queues.get(job.getType());
            if (queue == null || !removeById(queue, job.getId())) {
                continue;
            }
            Job running = JobTransitions.apply(job, JobEvent.started(now));
            processing.put(running.getId(), running);
            started.add(running);
        }
        return started;
    }

    /**
     * Takes a job out of the in-flight set, returning its latest snapshot (which carries a
     * cancellation flag if one was set while it ran).
     */
    public synchronized Optional<Job> completeProcessing(String jobId) {
        return Optional.ofNullable(processing.remove(jobId));
    }

    public synchronized void recordFinished(Job job) {
        finished.put(job.getId(), job);
        outcomes.put(job.getId(), job.isFailed());
    }

    public synchronized CancelOutcome cancel(String jobId) {
        for (List<Job> queue : queues.values()) {
            if (removeById(queue, jobId)) {
                return CancelOutcome.REMOVED;
            }
        }
        if (delayed.remove(jobId) != null) {
            return CancelOutcome.REMOVED;
        }
        Job running = processing.get(jobId);
        if (running != null) {
            processing.put(jobId, JobTransitions.apply(running, JobEvent.cancelRequested()));
            return CancelOutcome.FLAGGED;
        }
        return CancelOutcome.NOT_CANCELLABLE;
    }

    public synchronized Lookup status(String jobId) {
        Job done = finished.get(jobId);
        if (done != null) {
            return new Lookup(done.isFailed() ? JobStatus.FAILED : JobStatus.COMPLETED, done);
        }
        Job running = processing.get(jobId);
        if (running != null) {
            return new Lookup(JobStatus.PROCESSING, running);
        }
        Job parked = delayed.get(jobId);
        if (parked != null) {
            return new Lookup(JobStatus.QUEUED, parked);
        }
        for (List<Job> queue : queues.values()) {
            for (Job job : queue) {
                if (job.getId().equals(jobId)) {
                    return new Lookup(JobStatus.QUEUED, job);
                }
            }
        }
        return new Lookup(JobStatus.NOT_FOUND, null);
    }

    /**
     * Restores the requested priority of queued jobs whose dependencies just cleared.
     */
    public synchronized List<Job> restoreSatisfiedDependents(String completedJobId) {
        List<Job> restored = new ArrayList<>();
        for (List<Job> queue : queues.values()) {
            boolean changed = false;
            for (int i = 0; i < queue.size(); i++) {
                Job job = queue.get(i);
                if (job.getDependencies().contains(completedJobId) && dependenciesSatisfied(job)) {
                    Job updated = JobTransitions.apply(job, JobEvent.dependenciesSatisfied());
                    if (updated != job) {
                        queue.set(i, updated);
                        restored.add(updated);
                        changed = true;
                    }
                }
            }
            if (changed) {
                queue.sort(QUEUE_ORDER);
            }
        }
        return restored;
    }

    /**
     * Removes and returns queued jobs that depend on a job that failed permanently.
     */
    public synchronized List<Job> removeDependentsOf(String failedJobId) {
        List<Job> removed = new ArrayList<>();
        for (List<Job> queue : queues.values()) {
            Iterator<Job> it = queue.iterator();
            while (it.hasNext()) {
                Job job = it.next();
                if (job.getDependencies().contains(failedJobId)) {
                    it.remove();
                    removed.add(job);
                }
            }
        }
        return removed;
    }

    public synchronized Map<JobType, Integer> queueSizes() {
        Map<JobType, Integer> sizes = new EnumMap<>(JobType.class);
        queues.forEach((type, queue) -> sizes.put(type, queue.size()));
        delayed.values().forEach(job -> sizes.merge(job.getType(), 1, Integer::sum));
        return sizes;
    }

    public synchronized int queuedCount() {
        return queues.values().stream().mapToInt(List::size).sum() + delayed.size();
    }

    public synchronized boolean hasQueued(JobType type) {
        List<Job> queue = queues.get(type);
        return queue != null && !queue.isEmpty();
    }

    public synchronized int processingCount() {
        return processing.size();
    }

    public synchronized List<Job> processingSnapshot() {
        return List.copyOf(processing.values());
    }

    public synchronized Optional<Job> finishedJob(String jobId) {
        return Optional.ofNullable(finished.get(jobId));
    }

    private static boolean removeById(List<Job> queue, String jobId) {
        Iterator<Job> it = queue.iterator();
        while (it.hasNext()) {
            if (it.next().getId().equals(jobId)) {
                it.remove();
                return true;
            }
        }
        return false;
    }
}
