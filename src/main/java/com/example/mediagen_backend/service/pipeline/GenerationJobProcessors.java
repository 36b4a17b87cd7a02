package com.example.mediagen_backend.service.pipeline;

import com.example.mediagen_backend.engine.GenerationException;
import com.example.mediagen_backend.engine.Interfaces.AudioGenerationEngine;
import com.example.mediagen_backend.engine.Interfaces.ImageGenerationEngine;
import com.example.mediagen_backend.engine.Interfaces.VideoGenerationEngine;
import com.example.mediagen_backend.engine.PermanentGenerationException;
import com.example.mediagen_backend.model.Job;
import com.example.mediagen_backend.model.JobResult;
import com.example.mediagen_backend.service.scheduler.BatchScheduler;
import com.example.mediagen_backend.util.JobType;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Batch processors that let the scheduler drive the generation engines. Each job carries its
 * engine request under {@link #REQUEST_KEY}; jobs of a batch run one after another on the worker
 * thread and a successful job's result holds the asset url under {@link #URL_KEY}.
 */
@Component
public class GenerationJobProcessors {
    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationJobProcessors.class);
    static final String REQUEST_KEY = "request";
    static final String URL_KEY = "url";
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {
    };

    private final BatchScheduler scheduler;
    private final ImageGenerationEngine imageEngine;
    private final AudioGenerationEngine audioEngine;
    private final VideoGenerationEngine videoEngine;
    private final ObjectMapper mapper;

    public GenerationJobProcessors(BatchScheduler scheduler,
                                   ImageGenerationEngine imageEngine,
                                   AudioGenerationEngine audioEngine,
                                   VideoGenerationEngine videoEngine,
                                   ObjectMapper mapper) {
        this.scheduler = scheduler;
        this.imageEngine = imageEngine;
        this.audioEngine = audioEngine;
        this.videoEngine = videoEngine;
        this.mapper = mapper;
    }

    @PostConstruct
    public void register() {
        scheduler.registerProcessor(JobType.IMAGE, this::processImages);
        scheduler.registerProcessor(JobType.AUDIO, this::processAudio);
        scheduler.registerProcessor(JobType.VIDEO, this::processVideos);
    }

    Map<String, Object> payload(Object request) {
        return Map.of(REQUEST_KEY, mapper.convertValue(request, MAP));
    }

    List<JobResult> processImages(List<Job> jobs) {
        List<JobResult> results = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            results.add(run(job, () -> imageEngine.generate(request(job, ImageGenerationEngine.Request.class)).url()));
        }
        return results;
    }

    List<JobResult> processAudio(List<Job> jobs) {
        List<JobResult> results = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            results.add(run(job, () -> audioEngine.generate(request(job, AudioGenerationEngine.Request.class)).url()));
        }
        return results;
    }

    List<JobResult> processVideos(List<Job> jobs) {
        List<JobResult> results = new ArrayList<>(jobs.size());
        for (Job job : jobs) {
            results.add(run(job, () -> videoEngine.generate(request(job, VideoGenerationEngine.Request.class),
                    () -> cancelRequested(job.getId())).url()));
        }
        return results;
    }

    private boolean cancelRequested(String jobId) {
        return scheduler.jobStatus(jobId).jobIfPresent().map(Job::isCancelRequested).orElse(false);
    }

    private <T> T request(Job job, Class<T> type) throws PermanentGenerationException {
        Object raw = job.getData().get(REQUEST_KEY);
        if (raw == null) {
            throw new PermanentGenerationException("Job " + job.getId() + " carries no generation request");
        }
        try {
            return mapper.convertValue(raw, type);
        } catch (IllegalArgumentException e) {
            throw new PermanentGenerationException("Job " + job.getId() + " has a malformed request: " + e.getMessage(), e);
        }
    }

    private JobResult run(Job job, RetryExecutor.Call<String> call) {
        long t0 = System.nanoTime();
        try {
            String url = call.call();
            return JobResult.ok(Map.of(URL_KEY, url), Duration.ofNanos(System.nanoTime() - t0), job.getCostEstimate());
        } catch (PermanentGenerationException e) {
            LOGGER.warn("Generation job rejected jobId={} type={} error={}", job.getId(), job.getType(), e.getMessage());
            return JobResult.permanentFailure(e.getMessage(), Duration.ofNanos(System.nanoTime() - t0));
        } catch (GenerationException e) {
            LOGGER.warn("Generation job failed jobId={} type={} attempt={} error={}", job.getId(), job.getType(),
                    job.getRetryCount() + 1, e.getMessage());
            return JobResult.failure(e.getMessage(), Duration.ofNanos(System.nanoTime() - t0));
        }
    }
}
