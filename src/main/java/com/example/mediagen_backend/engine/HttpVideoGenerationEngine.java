package com.example.mediagen_backend.engine;

import com.example.mediagen_backend.engine.Interfaces.VideoGenerationEngine;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Starts an image-to-video job on the gateway and polls it to completion. Polling repeats at the
 * configured interval under a hard wall-clock timeout; expiry is a retryable failure.
 */
public class HttpVideoGenerationEngine implements VideoGenerationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpVideoGenerationEngine.class);

    private final GenerationGateway gateway;
    private final Duration pollInterval;
    private final Duration timeout;

    public HttpVideoGenerationEngine(GenerationGateway gateway, Duration pollInterval, Duration timeout) {
        this.gateway = gateway;
        this.pollInterval = pollInterval;
        this.timeout = timeout;
    }

    @Override
    public Result generate(Request request, BooleanSupplier cancelled) throws GenerationException {
        if (request.imageUrl() == null || request.imageUrl().isBlank()) {
            throw new PermanentGenerationException("Video generation needs an image url");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("imageUrl", request.imageUrl());
        body.put("prompt", request.prompt());
        body.put("duration", request.durationSeconds() > 0 ? request.durationSeconds() : 5);
        body.put("cameraMovement", request.cameraMovement() == null ? "static" : request.cameraMovement());
        body.put("motionIntensity", request.motionIntensity() > 0 ? request.motionIntensity() : 50);
        body.put("projectId", request.projectId());
        body.put("sceneId", request.sceneId());

        long t0 = System.nanoTime();
        JsonNode started = gateway.post("/api/videos/generate", body, "Video generation");
        String immediateUrl = GenerationGateway.text(started, "videoUrl");
        String jobId = GenerationGateway.text(started, "jobId");
        if (immediateUrl != null && !immediateUrl.isBlank()) {
            return new Result(immediateUrl, "http", jobId, Map.of());
        }
        if (jobId == null || jobId.isBlank()) {
            throw new GenerationException("Video generation returned neither jobId nor videoUrl");
        }
        LOGGER.info("VIDEO started sceneId={} providerJobId={}", request.sceneId(), jobId);

        String url = pollForCompletion(jobId, cancelled);
        LOGGER.info("VIDEO generated sceneId={} providerJobId={} in={}ms", request.sceneId(), jobId,
                (System.nanoTime() - t0) / 1_000_000);
        return new Result(url, "http", jobId, Map.of());
    }

    String pollForCompletion(String jobId, BooleanSupplier cancelled) throws GenerationException {
        AtomicInteger polls = new AtomicInteger();
        try {
            return Mono.defer(() -> pollOnce(jobId, cancelled, polls.incrementAndGet()))
                    .subscribeOn(Schedulers.boundedElastic())
                    .repeatWhenEmpty(repeats -> repeats.delayElements(pollInterval, Schedulers.boundedElastic()))
                    .timeout(timeout)
                    .onErrorMap(TimeoutException.class, e -> new GenerationException("Video generation timeout after "
                            + timeout.toMillis() + "ms providerJobId=" + jobId + " polls=" + polls.get(), e))
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof GenerationException ge) {
                throw ge;
            }
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new GenerationException("Video polling interrupted", cause);
            }
            throw e;
        }
    }

    /**
     * One status request. Emits the url when done, errors when the job failed and completes empty
     * while it is still running.
     */
    private Mono<String> pollOnce(String jobId, BooleanSupplier cancelled, int poll) {
        if (cancelled.getAsBoolean()) {
            return Mono.error(new PermanentGenerationException("Video generation cancelled providerJobId=" + jobId));
        }
        return Mono.fromCallable(() -> gateway.get("/api/videos/{jobId}", "Video status", jobId))
                .flatMap(status -> {
                    String state = GenerationGateway.text(status, "status");
                    String normalized = state == null ? "" : state.toLowerCase(Locale.ROOT);
                    if ("completed".equals(normalized) || "succeeded".equals(normalized)) {
                        String url = GenerationGateway.text(status, "videoUrl");
                        if (url == null || url.isBlank()) {
                            return Mono.error(new GenerationException(
                                    "Video job completed without videoUrl providerJobId=" + jobId));
                        }
                        return Mono.just(url);
                    }
                    if ("failed".equals(normalized)) {
                        String error = GenerationGateway.text(status, "error");
                        return Mono.error(new GenerationException(error == null ? "Video generation failed" : error));
                    }
                    LOGGER.debug("VIDEO poll providerJobId={} status={} poll={}", jobId, normalized, poll);
                    return Mono.empty();
                });
    }
}
