package com.example.mediagen_backend.service.scheduler;

import com.example.mediagen_backend.model.Job;
import com.example.mediagen_backend.model.JobHistoryRecord;
import com.example.mediagen_backend.repository.JobHistoryRepository;
import com.example.mediagen_backend.util.JobType;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public class JpaJobHistoryStore implements JobHistoryStore {
    private static final int MAX_ERROR_LENGTH = 2000;

    private final JobHistoryRepository repository;

    public JpaJobHistoryStore(JobHistoryRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public void record(Job job) {
        Entry e = Entry.from(job);
        String error = e.error() != null && e.error().length() > MAX_ERROR_LENGTH
                ? e.error().substring(0, MAX_ERROR_LENGTH)
                : e.error();
        repository.save(new JobHistoryRecord(e.jobId(), e.type(), e.status(), e.priority(), e.retryCount(),
                e.maxRetries(), e.cost(), error, e.createdAt(), e.finishedAt()));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Entry> recent(JobType type, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        List<JobHistoryRecord> records = type == null
                ? repository.findAllByOrderByFinishedAtDesc(page)
                : repository.findByTypeOrderByFinishedAtDesc(type, page);
        return records.stream()
                .map(r -> new Entry(r.getJobId(), r.getType(), r.getStatus(), r.getPriority(), r.getRetryCount(),
                        r.getMaxRetries(), r.getCost(), r.getError(), r.getCreatedAt(), r.getFinishedAt()))
                .toList();
    }
}
