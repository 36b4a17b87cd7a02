package com.example.mediagen_backend.engine.Interfaces;

import com.example.mediagen_backend.engine.GenerationException;

import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Image-to-video generation. Providers work asynchronously, so implementations poll until the
 * provider job finishes, times out or {@code cancelled} reports true.
 */
public interface VideoGenerationEngine {
    record Request(String projectId, String sceneId, String imageUrl, String prompt, int durationSeconds,
                   String cameraMovement, int motionIntensity) {}
    record Result(String url, String provider, String providerJobId, Map<String, Object> meta) {}

    Result generate(Request request, BooleanSupplier cancelled) throws GenerationException;
}
