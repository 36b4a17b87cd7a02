package com.example.mediagen_backend.dto.pipeline;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate of one pipeline run. {@code success} is true only when no stage recorded an error and
 * the run was not cancelled.
 */
public record PipelineResult(String runId,
                             String projectId,
                             boolean success,
                             boolean cancelled,
                             double totalCost,
                             GeneratedAssets generatedAssets,
                             List<StageError> errors,
                             CachingStats cachingStats,
                             Instant startedAt,
                             Instant completedAt) {

    public record GeneratedAssets(List<GeneratedAsset> images, List<GeneratedAsset> audio,
                                  List<GeneratedAsset> videos) {
    }
}
