package com.example.mediagen_backend.dto.pipeline;

import com.example.mediagen_backend.util.PipelineStage;
import com.example.mediagen_backend.util.ProgressStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Progress event for one scene in one stage.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerationProgress(String runId,
                                 PipelineStage stage,
                                 String sceneId,
                                 int progress,
                                 ProgressStatus status,
                                 String error,
                                 String assetUrl,
                                 Double estimatedCost,
                                 Instant at) {
}
