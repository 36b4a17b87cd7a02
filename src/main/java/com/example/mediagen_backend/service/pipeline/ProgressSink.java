package com.example.mediagen_backend.service.pipeline;

import com.example.mediagen_backend.dto.pipeline.GenerationProgress;

/**
 * Fire-and-forget receiver of pipeline progress events.
 */
@FunctionalInterface
public interface ProgressSink {
    void emit(GenerationProgress event);
}
