package com.example.mediagen_backend.service.pipeline;

import com.example.mediagen_backend.config.PipelineProperties;
import com.example.mediagen_backend.dto.pipeline.GeneratedAsset;
import com.example.mediagen_backend.dto.pipeline.GenerationProgress;
import com.example.mediagen_backend.dto.pipeline.PipelineResult;
import com.example.mediagen_backend.dto.pipeline.ProjectConfig;
import com.example.mediagen_backend.dto.pipeline.SceneData;
import com.example.mediagen_backend.engine.GenerationException;
import com.example.mediagen_backend.engine.Interfaces.AudioGenerationEngine;
import com.example.mediagen_backend.engine.Interfaces.ImageGenerationEngine;
import com.example.mediagen_backend.engine.Interfaces.VideoGenerationEngine;
import com.example.mediagen_backend.engine.PermanentGenerationException;
import com.example.mediagen_backend.model.Job;
import com.example.mediagen_backend.service.cache.CacheHit;
import com.example.mediagen_backend.service.cache.CacheStore;
import com.example.mediagen_backend.service.scheduler.BatchScheduler;
import com.example.mediagen_backend.service.scheduler.JobSubmission;
import com.example.mediagen_backend.util.DispatchMode;
import com.example.mediagen_backend.util.JobPriority;
import com.example.mediagen_backend.util.PipelineStage;
import com.example.mediagen_backend.util.ProgressStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Drives a project through the images, audio and videos stages.
 * <p>
 * Images and audio run in batches of concurrent scene calls with a pause between batches; videos
 * run one scene at a time because each call polls a provider job and the provider is stricter
 * about rate. Every call consults the cache first and writes successful results back. Failures
 * are isolated per scene and stage and collected in the result.
 */
@Service
public class PipelineOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
    static final String NO_IMAGE_ERROR = "No image available for video generation";

    private final CacheStore cache;
    private final BatchScheduler scheduler;
    private final GenerationJobProcessors jobProcessors;
    private final ImageGenerationEngine imageEngine;
    private final AudioGenerationEngine audioEngine;
    private final VideoGenerationEngine videoEngine;
    private final CostEstimator costEstimator;
    private final ProgressSink progress;
    private final PipelineProperties properties;
    private final Executor generationExecutor;
    private final Executor runExecutor;
    private final Clock clock;
    private final RetryExecutor retryExecutor;
    private final Map<String, PipelineRun> runs;

    public PipelineOrchestrator(CacheStore cache,
                                BatchScheduler scheduler,
                                GenerationJobProcessors jobProcessors,
                                ImageGenerationEngine imageEngine,
                                AudioGenerationEngine audioEngine,
                                VideoGenerationEngine videoEngine,
                                CostEstimator costEstimator,
                                ProgressSink progress,
                                PipelineProperties properties,
                                @Qualifier("generationTaskExecutor") Executor generationExecutor,
                                @Qualifier("pipelineRunExecutor") Executor runExecutor,
                                Clock clock) {
        this.cache = cache;
        this.scheduler = scheduler;
        this.jobProcessors = jobProcessors;
        this.imageEngine = imageEngine;
        this.audioEngine = audioEngine;
        this.videoEngine = videoEngine;
        this.costEstimator = costEstimator;
        this.progress = progress;
        this.properties = properties;
        this.generationExecutor = generationExecutor;
        this.runExecutor = runExecutor;
        this.clock = clock;
        this.retryExecutor = new RetryExecutor(properties.getRetryBaseDelayMs());
        int historyLimit = Math.max(1, properties.getRunHistoryLimit());
        this.runs = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PipelineRun> eldest) {
                return size() > historyLimit && eldest.getValue().completion().isDone();
            }
        });
    }

    /**
     * Runs the whole pipeline on the calling thread and returns the aggregate result.
     */
    public PipelineResult runPipeline(ProjectConfig config) {
        PipelineRun run = register(config);
        execute(run);
        return run.completion().join();
    }

    /**
     * Starts a run in the background and returns its id.
     */
    public String startPipeline(ProjectConfig config) {
        PipelineRun run = register(config);
        runExecutor.execute(() -> execute(run));
        return run.runId();
    }

    public Optional<PipelineResult> result(String runId) {
        PipelineRun run = runs.get(runId);
        if (run == null || !run.completion().isDone()) {
            return Optional.empty();
        }
        return Optional.of(run.completion().join());
    }

    public boolean isKnown(String runId) {
        return runs.containsKey(runId);
    }

    public boolean isRunning(String runId) {
        PipelineRun run = runs.get(runId);
        return run != null && !run.completion().isDone();
    }

    public CompletableFuture<PipelineResult> completion(String runId) {
        PipelineRun run = runs.get(runId);
        return run == null ? null : run.completion();
    }

    /**
     * Stops scheduling further batches and stages of the run. Calls already in flight drain.
     * Returns false for unknown or finished runs.
     */
    public boolean cancel(String runId) {
        PipelineRun run = runs.get(runId);
        if (run == null || run.completion().isDone() || !run.cancel()) {
            return false;
        }
        run.schedulerJobIds().forEach(scheduler::cancelJob);
        LOGGER.info("PIPELINE cancel requested runId={} project={}", runId, run.config().id());
        return true;
    }

    public double estimateCost(ProjectConfig config) {
        return costEstimator.project(config);
    }

    private PipelineRun register(ProjectConfig config) {
        if (config == null || config.scenes() == null || config.scenes().isEmpty()) {
            throw new IllegalArgumentException("project needs at least one scene");
        }
        PipelineRun run = new PipelineRun(UUID.randomUUID().toString(), config, properties.getDefaultBatchSize(),
                properties.getDefaultMaxRetries(), clock.instant());
        runs.put(run.runId(), run);
        return run;
    }

    private void execute(PipelineRun run) {
        long t0 = System.nanoTime();
        LOGGER.info("PIPELINE START runId={} project={} scenes={} caching={} batchSize={} maxRetries={} mode={}",
                run.runId(), run.config().id(), run.scenes().size(), run.caching(), run.batchSize(), run.maxRetries(),
                run.dispatchMode());
        try {
            runBatchedStage(run, PipelineStage.IMAGES, properties.getImages().getInterBatchDelayMs());
            runBatchedStage(run, PipelineStage.AUDIO, properties.getAudio().getInterBatchDelayMs());
            runVideoStage(run);
        } catch (RuntimeException e) {
            LOGGER.error("PIPELINE aborted runId={} err={}", run.runId(), e.toString(), e);
            run.recordError(null, PipelineStage.IMAGES, "Pipeline aborted: " + e.getMessage());
        } finally {
            PipelineResult result = run.toResult(clock.instant());
            LOGGER.info("PIPELINE {} runId={} project={} cost={} errors={} cacheHits={} cacheMisses={} saved={} in={}ms",
                    result.success() ? "DONE" : (result.cancelled() ? "CANCELLED" : "PARTIAL"), run.runId(),
                    run.config().id(), result.totalCost(), result.errors().size(), result.cachingStats().cacheHits(),
                    result.cachingStats().cacheMisses(), result.cachingStats().costSaved(),
                    (System.nanoTime() - t0) / 1_000_000);
            run.completion().complete(result);
        }
    }

    private void runBatchedStage(PipelineRun run, PipelineStage stage, long interBatchDelayMs) {
        List<SceneData> scenes = run.scenes();
        int batchSize = run.batchSize();
        LOGGER.info("STAGE START runId={} stage={} scenes={}", run.runId(), stage.label(), scenes.size());
        for (int from = 0; from < scenes.size(); from += batchSize) {
            if (run.isCancelled()) {
                LOGGER.info("STAGE stopped runId={} stage={} reason=cancelled", run.runId(), stage.label());
                return;
            }
            List<SceneData> batch = scenes.subList(from, Math.min(from + batchSize, scenes.size()));
            List<CompletableFuture<Void>> futures = new ArrayList<>(batch.size());
            for (SceneData scene : batch) {
                futures.add(CompletableFuture.runAsync(() -> processScene(run, stage, scene), generationExecutor));
            }
            awaitAll(run, stage, batch, futures);
            if (from + batchSize < scenes.size() && !pause(run, interBatchDelayMs)) {
                return;
            }
        }
    }

    private void runVideoStage(PipelineRun run) {
        List<SceneData> scenes = run.scenes();
        LOGGER.info("STAGE START runId={} stage={} scenes={}", run.runId(), PipelineStage.VIDEOS.label(), scenes.size());
        for (int i = 0; i < scenes.size(); i++) {
            if (run.isCancelled()) {
                LOGGER.info("STAGE stopped runId={} stage={} reason=cancelled", run.runId(), PipelineStage.VIDEOS.label());
                return;
            }
            processScene(run, PipelineStage.VIDEOS, scenes.get(i));
            if (i + 1 < scenes.size() && !pause(run, properties.getVideos().getInterBatchDelayMs())) {
                return;
            }
        }
    }

    private void awaitAll(PipelineRun run, PipelineStage stage, List<SceneData> batch,
                          List<CompletableFuture<Void>> futures) {
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.cancel();
                return;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                LOGGER.error("Scene task crashed runId={} stage={} sceneId={} err={}", run.runId(), stage.label(),
                        batch.get(i).id(), cause.toString(), cause);
                run.recordError(batch.get(i).id(), stage, cause.getMessage());
            }
        }
    }

    private boolean pause(PipelineRun run, long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.cancel();
            return false;
        }
    }

    private void processScene(PipelineRun run, PipelineStage stage, SceneData scene) {
        switch (stage) {
            case IMAGES -> processImage(run, scene);
            case AUDIO -> processAudio(run, scene);
            case VIDEOS -> processVideo(run, scene);
        }
    }

    private void processImage(PipelineRun run, SceneData scene) {
        PipelineProperties.Stage cfg = properties.getImages();
        ImageGenerationEngine.Request request = new ImageGenerationEngine.Request(run.config().id(), scene.id(),
                scene.imagePrompt(), cfg.getModel(), "1024x1024", "standard", "vivid");
        generate(run, PipelineStage.IMAGES, scene, scene.imagePrompt(), costEstimator.image(scene), request,
                () -> imageEngine.generate(request).url());
    }

    private void processAudio(PipelineRun run, SceneData scene) {
        PipelineProperties.Stage cfg = properties.getAudio();
        String voiceId = scene.voiceIdOr(properties.getDefaultVoiceId());
        AudioGenerationEngine.Request request = new AudioGenerationEngine.Request(run.config().id(), scene.id(),
                scene.narration(), voiceId, cfg.getModel(),
                scene.audioSettings() == null ? null : scene.audioSettings().emotion(),
                scene.audioSettings() == null || scene.audioSettings().speed() == null ? 1.0 : scene.audioSettings().speed());
        String cachePrompt = (scene.narration() == null ? "" : scene.narration()) + "-" + voiceId;
        generate(run, PipelineStage.AUDIO, scene, cachePrompt, costEstimator.audio(scene), request,
                () -> audioEngine.generate(request).url());
    }

    private void processVideo(PipelineRun run, SceneData scene) {
        double estimate = costEstimator.video(scene);
        Optional<String> imageUrl = run.imageUrl(scene.id());
        if (imageUrl.isEmpty()) {
            emit(run, PipelineStage.VIDEOS, scene.id(), 0, ProgressStatus.PROCESSING, null, null, estimate);
            emit(run, PipelineStage.VIDEOS, scene.id(), 100, ProgressStatus.FAILED, NO_IMAGE_ERROR, null, estimate);
            run.recordError(scene.id(), PipelineStage.VIDEOS, NO_IMAGE_ERROR);
            return;
        }
        VideoGenerationEngine.Request request = new VideoGenerationEngine.Request(run.config().id(), scene.id(),
                imageUrl.get(), scene.videoPrompt(), scene.durationOr(properties.getDefaultVideoDurationSeconds()),
                scene.videoSettings() == null ? null : scene.videoSettings().cameraMovement(),
                scene.videoSettings() == null || scene.videoSettings().motionIntensity() == null
                        ? 50 : scene.videoSettings().motionIntensity());
        String cachePrompt = imageUrl.get() + "-" + (scene.videoPrompt() == null ? "" : scene.videoPrompt());
        generate(run, PipelineStage.VIDEOS, scene, cachePrompt, estimate, request,
                () -> videoEngine.generate(request, run::isCancelled).url());
    }

    private void generate(PipelineRun run, PipelineStage stage, SceneData scene, String cachePrompt, double estimate,
                          Object request, RetryExecutor.Call<String> call) {
        PipelineProperties.Stage cfg = stageConfig(stage);
        emit(run, stage, scene.id(), 0, ProgressStatus.PROCESSING, null, null, estimate);

        if (run.caching()) {
            Optional<CacheHit> hit = lookup(cachePrompt, cfg);
            if (hit.isPresent() && hit.get().data() instanceof String url) {
                run.recordCacheHit(estimate);
                run.recordAsset(stage, new GeneratedAsset(scene.id(), url, 0, true, 0));
                LOGGER.info("CACHE HIT runId={} stage={} sceneId={} similarity={} saved={}", run.runId(),
                        stage.label(), scene.id(), hit.get().similarity(), estimate);
                emit(run, stage, scene.id(), 100, ProgressStatus.COMPLETED, null, url, 0.0);
                return;
            }
            run.recordCacheMiss();
        }

        String context = stage.label() + ":" + scene.id();
        try {
            RetryExecutor.Outcome<String> outcome = run.dispatchMode() == DispatchMode.SCHEDULER
                    ? viaScheduler(run, stage, request, estimate)
                    : retryExecutor.execute(call, run.maxRetries(), context, run::isCancelled);
            String url = outcome.value();
            run.recordAsset(stage, new GeneratedAsset(scene.id(), url, estimate, false, outcome.retryCount()));
            if (run.caching()) {
                cache.put(cachePrompt, cfg.getModel(), cfg.getProvider(), url, estimate, 1.0,
                        Set.of(scene.id(), stage.jobType().name().toLowerCase(Locale.ROOT)), null);
            }
            LOGGER.info("ASSET DONE runId={} stage={} sceneId={} retries={} cost={}", run.runId(), stage.label(),
                    scene.id(), outcome.retryCount(), estimate);
            emit(run, stage, scene.id(), 100, ProgressStatus.COMPLETED, null, url, estimate);
        } catch (GenerationException e) {
            LOGGER.warn("ASSET FAILED runId={} stage={} sceneId={} error={}", run.runId(), stage.label(), scene.id(),
                    e.getMessage());
            run.recordError(scene.id(), stage, e.getMessage());
            emit(run, stage, scene.id(), 100, ProgressStatus.FAILED, e.getMessage(), null, estimate);
        }
    }

    private Optional<CacheHit> lookup(String cachePrompt, PipelineProperties.Stage cfg) {
        if (cfg.getSimilarityThreshold() >= 1.0) {
            return cache.getExact(cachePrompt, cfg.getModel());
        }
        return cache.getFuzzy(cachePrompt, cfg.getModel(), cfg.getSimilarityThreshold());
    }

    private RetryExecutor.Outcome<String> viaScheduler(PipelineRun run, PipelineStage stage, Object request,
                                                       double estimate) throws GenerationException {
        String jobId = scheduler.submitJob(new JobSubmission(stage.jobType(), JobPriority.MEDIUM,
                jobProcessors.payload(request), run.maxRetries(), Set.of(), null, estimate));
        run.schedulerJobIds().add(jobId);
        Job done;
        try {
            done = scheduler.awaitJob(jobId).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.cancelJob(jobId);
            throw new PermanentGenerationException("Interrupted while waiting for job " + jobId, e);
        } catch (ExecutionException | CompletionException e) {
            throw new GenerationException("Job " + jobId + " could not be awaited: " + e.getMessage(), e);
        } finally {
            run.schedulerJobIds().remove(jobId);
        }
        if (done.isFailed()) {
            throw new GenerationException(done.getError());
        }
        Object url = done.getResult().get(GenerationJobProcessors.URL_KEY);
        if (url == null) {
            throw new GenerationException("Job " + jobId + " completed without an asset url");
        }
        return new RetryExecutor.Outcome<>(url.toString(), done.getRetryCount());
    }

    private PipelineProperties.Stage stageConfig(PipelineStage stage) {
        return switch (stage) {
            case IMAGES -> properties.getImages();
            case AUDIO -> properties.getAudio();
            case VIDEOS -> properties.getVideos();
        };
    }

    private void emit(PipelineRun run, PipelineStage stage, String sceneId, int percent, ProgressStatus status,
                      String error, String url, Double estimatedCost) {
        try {
            progress.emit(new GenerationProgress(run.runId(), stage, sceneId, percent, status, error, url,
                    estimatedCost, clock.instant()));
        } catch (RuntimeException e) {
            LOGGER.warn("Progress emit failed runId={} stage={} sceneId={} err={}", run.runId(), stage.label(),
                    sceneId, e.toString());
        }
    }
}
