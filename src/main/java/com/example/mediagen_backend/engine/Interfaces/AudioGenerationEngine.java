package com.example.mediagen_backend.engine.Interfaces;

import com.example.mediagen_backend.engine.GenerationException;

import java.util.Map;

public interface AudioGenerationEngine {
    record Request(String projectId, String sceneId, String text, String voiceId, String model, String emotion,
                   double speed) {}
    record Result(String url, String provider, Map<String, Object> meta) {}

    Result generate(Request request) throws GenerationException;
}
