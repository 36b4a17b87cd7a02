package com.example.mediagen_backend.controller;

import com.example.mediagen_backend.dto.pipeline.GenerationProgress;
import com.example.mediagen_backend.dto.pipeline.PipelineResult;
import com.example.mediagen_backend.dto.pipeline.PipelineRunResponse;
import com.example.mediagen_backend.dto.pipeline.ProjectConfig;
import com.example.mediagen_backend.service.pipeline.PipelineOrchestrator;
import com.example.mediagen_backend.service.pipeline.PipelineProgressBroadcaster;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

@RestController
@RequestMapping("/v1/pipelines")
public class PipelineController {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineController.class);

    private final PipelineOrchestrator orchestrator;
    private final PipelineProgressBroadcaster broadcaster;

    public PipelineController(PipelineOrchestrator orchestrator, PipelineProgressBroadcaster broadcaster) {
        this.orchestrator = orchestrator;
        this.broadcaster = broadcaster;
    }

    @PostMapping
    public ResponseEntity<PipelineRunResponse> start(@Valid @RequestBody ProjectConfig config) {
        String runId = orchestrator.startPipeline(config);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new PipelineRunResponse(runId, "RUNNING", orchestrator.estimateCost(config)));
    }

    @PostMapping("/estimate")
    public Map<String, Object> estimate(@Valid @RequestBody ProjectConfig config) {
        return Map.of("projectId", config.id(), "estimatedCost", orchestrator.estimateCost(config));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<?> result(@PathVariable String runId) {
        if (!orchestrator.isKnown(runId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "RUN_NOT_FOUND");
        }
        return orchestrator.result(runId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("runId", runId, "status", "RUNNING")));
    }

    @DeleteMapping("/{runId}")
    public Map<String, Object> cancel(@PathVariable String runId) {
        if (!orchestrator.isKnown(runId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "RUN_NOT_FOUND");
        }
        return Map.of("runId", runId, "cancelled", orchestrator.cancel(runId));
    }

    /**
     * Server-Sent Events stream of progress for one run. Closes when the run finishes.
     */
    @GetMapping(path = "/{runId}/events", produces = "text/event-stream")
    public SseEmitter events(@PathVariable String runId) {
        CompletableFuture<PipelineResult> completion = orchestrator.completion(runId);
        if (completion == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "RUN_NOT_FOUND");
        }
        SseEmitter emitter = new SseEmitter(0L);
        Consumer<GenerationProgress> consumer = event -> send(emitter, "progress", event);
        Runnable unsubscribe = broadcaster.subscribe(runId, consumer);
        emitter.onCompletion(unsubscribe);
        emitter.onTimeout(unsubscribe);
        emitter.onError(t -> unsubscribe.run());

        completion.whenComplete((result, error) -> {
            try {
                if (result != null) {
                    send(emitter, "result", result);
                }
            } catch (IllegalStateException e) {
                LOGGER.debug("SSE result not delivered runId={} err={}", runId, e.toString());
            } finally {
                unsubscribe.run();
                emitter.complete();
            }
        });
        return emitter;
    }

    private static void send(SseEmitter emitter, String name, Object payload) {
        try {
            emitter.send(SseEmitter.event().name(name).data(payload));
        } catch (IOException | IllegalStateException e) {
            LOGGER.debug("SSE send failed event={} err={}", name, e.toString());
            throw new IllegalStateException("SSE client gone", e);
        }
    }
}
