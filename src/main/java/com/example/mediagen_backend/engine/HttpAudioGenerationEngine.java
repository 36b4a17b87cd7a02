package com.example.mediagen_backend.engine;

import com.example.mediagen_backend.engine.Interfaces.AudioGenerationEngine;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class HttpAudioGenerationEngine implements AudioGenerationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpAudioGenerationEngine.class);

    private final GenerationGateway gateway;

    public HttpAudioGenerationEngine(GenerationGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public Result generate(Request request) throws GenerationException {
        if (request.text() == null || request.text().isBlank()) {
            throw new PermanentGenerationException("Narration text is empty");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", request.text());
        body.put("voiceId", request.voiceId());
        body.put("model", request.model());
        if (request.emotion() != null) {
            body.put("emotion", request.emotion());
        }
        body.put("speed", request.speed() > 0 ? request.speed() : 1.0);
        body.put("projectId", request.projectId());
        body.put("sceneId", request.sceneId());

        long t0 = System.nanoTime();
        JsonNode root = gateway.post("/api/audio/generate", body, "Audio generation");
        String url = GenerationGateway.text(root, "audioUrl");
        if (url == null || url.isBlank()) {
            throw new GenerationException("Audio generation returned no audioUrl");
        }
        LOGGER.info("AUDIO generated sceneId={} voice={} chars={} in={}ms", request.sceneId(), request.voiceId(),
                request.text().length(), (System.nanoTime() - t0) / 1_000_000);
        return new Result(url, "http", Map.of());
    }
}
