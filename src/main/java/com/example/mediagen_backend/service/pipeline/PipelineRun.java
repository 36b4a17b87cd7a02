package com.example.mediagen_backend.service.pipeline;

import com.example.mediagen_backend.dto.pipeline.CachingStats;
import com.example.mediagen_backend.dto.pipeline.GeneratedAsset;
import com.example.mediagen_backend.dto.pipeline.PipelineResult;
import com.example.mediagen_backend.dto.pipeline.ProjectConfig;
import com.example.mediagen_backend.dto.pipeline.SceneData;
import com.example.mediagen_backend.dto.pipeline.StageError;
import com.example.mediagen_backend.util.DispatchMode;
import com.example.mediagen_backend.util.PipelineStage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable bookkeeping of one pipeline run. Scene tasks of a stage write concurrently, so every
 * accumulator synchronizes on the run.
 */
class PipelineRun {
    private final String runId;
    private final ProjectConfig config;
    private final boolean caching;
    private final int batchSize;
    private final int maxRetries;
    private final DispatchMode dispatchMode;
    private final Instant startedAt;
    private final Map<String, Integer> sceneOrder = new HashMap<>();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CompletableFuture<PipelineResult> completion = new CompletableFuture<>();
    private final Set<String> schedulerJobIds = ConcurrentHashMap.newKeySet();

    private final Map<PipelineStage, List<GeneratedAsset>> assets = new EnumMap<>(PipelineStage.class);
    private final List<StageError> errors = new ArrayList<>();
    private final Map<String, String> imageUrls = new HashMap<>();
    private double totalCost;
    private double costSaved;
    private int cacheHits;
    private int cacheMisses;

    PipelineRun(String runId, ProjectConfig config, int defaultBatchSize, int defaultMaxRetries, Instant startedAt) {
        ProjectConfig.Options options = config.resolvedOptions();
        this.runId = runId;
        this.config = config;
        this.caching = options.cachingEnabled();
        this.batchSize = options.resolvedBatchSize(defaultBatchSize);
        this.maxRetries = options.resolvedMaxRetries(defaultMaxRetries);
        this.dispatchMode = options.resolvedDispatchMode();
        this.startedAt = startedAt;
        for (int i = 0; i < config.scenes().size(); i++) {
            sceneOrder.put(config.scenes().get(i).id(), i);
        }
        for (PipelineStage stage : PipelineStage.values()) {
            assets.put(stage, new ArrayList<>());
        }
    }

    String runId() {
        return runId;
    }

    ProjectConfig config() {
        return config;
    }

    List<SceneData> scenes() {
        return config.scenes();
    }

    boolean caching() {
        return caching;
    }

    int batchSize() {
        return batchSize;
    }

    int maxRetries() {
        return maxRetries;
    }

    DispatchMode dispatchMode() {
        return dispatchMode;
    }

    boolean isCancelled() {
        return cancelled.get();
    }

    boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    CompletableFuture<PipelineResult> completion() {
        return completion;
    }

    Set<String> schedulerJobIds() {
        return schedulerJobIds;
    }

    synchronized void recordAsset(PipelineStage stage, GeneratedAsset asset) {
        assets.get(stage).add(asset);
        totalCost += asset.cost();
        if (stage == PipelineStage.IMAGES) {
            imageUrls.put(asset.sceneId(), asset.url());
        }
    }

    synchronized void recordError(String sceneId, PipelineStage stage, String error) {
        errors.add(new StageError(sceneId, stage, error));
    }

    synchronized void recordCacheHit(double saved) {
        cacheHits++;
        costSaved += saved;
    }

    synchronized void recordCacheMiss() {
        cacheMisses++;
    }

    synchronized Optional<String> imageUrl(String sceneId) {
        return Optional.ofNullable(imageUrls.get(sceneId));
    }

    synchronized PipelineResult toResult(Instant completedAt) {
        Comparator<GeneratedAsset> assetOrder = Comparator.comparingInt(a -> orderOf(a.sceneId()));
        Comparator<StageError> errorOrder = Comparator.<StageError>comparingInt(e -> e.stage().ordinal())
                .thenComparingInt(e -> orderOf(e.sceneId()));
        List<StageError> sortedErrors = errors.stream().sorted(errorOrder).toList();
        return new PipelineResult(
                runId,
                config.id(),
                sortedErrors.isEmpty() && !cancelled.get(),
                cancelled.get(),
                totalCost,
                new PipelineResult.GeneratedAssets(
                        assets.get(PipelineStage.IMAGES).stream().sorted(assetOrder).toList(),
                        assets.get(PipelineStage.AUDIO).stream().sorted(assetOrder).toList(),
                        assets.get(PipelineStage.VIDEOS).stream().sorted(assetOrder).toList()),
                sortedErrors,
                new CachingStats(cacheHits, cacheMisses, costSaved),
                startedAt,
                completedAt);
    }

    private int orderOf(String sceneId) {
        return sceneOrder.getOrDefault(sceneId, Integer.MAX_VALUE);
    }
}
