package com.example.mediagen_backend.engine.Interfaces;

import com.example.mediagen_backend.engine.GenerationException;

import java.util.Map;

public interface ImageGenerationEngine {
    record Request(String projectId, String sceneId, String prompt, String model, String size, String quality,
                   String style) {}
    record Result(String url, String provider, Map<String, Object> meta) {}

    Result generate(Request request) throws GenerationException;
}
