package com.example.mediagen_backend.dto.pipeline;

import com.example.mediagen_backend.util.PipelineStage;

public record StageError(String sceneId, PipelineStage stage, String error) {
}
