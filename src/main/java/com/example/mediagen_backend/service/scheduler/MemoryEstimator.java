package com.example.mediagen_backend.service.scheduler;

import com.example.mediagen_backend.model.Job;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Heuristic working-set estimate for a job: a per-type base plus 5 MB per started MB of payload.
 */
public class MemoryEstimator {
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final ObjectMapper mapper;

    public MemoryEstimator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public long estimateMb(Job job) {
        long memory = switch (job.getType()) {
            case IMAGE -> 50;
            case VIDEO -> 200;
            case AUDIO -> 30;
            case SCRIPT -> 10;
        };
        if (!job.getData().isEmpty()) {
            long payloadBytes = payloadSize(job);
            memory += (long) Math.ceil((double) payloadBytes / BYTES_PER_MB) * 5;
        }
        return memory;
    }

    private long payloadSize(Job job) {
        try {
            return mapper.writeValueAsBytes(job.getData()).length;
        } catch (JsonProcessingException e) {
            return String.valueOf(job.getData()).length();
        }
    }
}
