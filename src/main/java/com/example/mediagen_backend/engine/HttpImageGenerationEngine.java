package com.example.mediagen_backend.engine;

import com.example.mediagen_backend.engine.Interfaces.ImageGenerationEngine;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class HttpImageGenerationEngine implements ImageGenerationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpImageGenerationEngine.class);

    private final GenerationGateway gateway;

    public HttpImageGenerationEngine(GenerationGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public Result generate(Request request) throws GenerationException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", request.prompt());
        body.put("model", request.model());
        body.put("size", request.size() == null ? "1024x1024" : request.size());
        body.put("quality", request.quality() == null ? "standard" : request.quality());
        body.put("style", request.style() == null ? "vivid" : request.style());
        body.put("projectId", request.projectId());
        body.put("sceneId", request.sceneId());

        long t0 = System.nanoTime();
        JsonNode root = gateway.post("/api/images/generate", body, "Image generation");
        String url = GenerationGateway.text(root, "imageUrl");
        if (url == null || url.isBlank()) {
            throw new GenerationException("Image generation returned no imageUrl");
        }
        LOGGER.info("IMAGE generated sceneId={} model={} in={}ms", request.sceneId(), request.model(),
                (System.nanoTime() - t0) / 1_000_000);
        return new Result(url, "http", Map.of());
    }
}
