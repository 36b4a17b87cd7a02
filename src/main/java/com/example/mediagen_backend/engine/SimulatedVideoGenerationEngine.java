package com.example.mediagen_backend.engine;

import com.example.mediagen_backend.engine.Interfaces.VideoGenerationEngine;
import com.example.mediagen_backend.util.Fingerprints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.BooleanSupplier;

public class SimulatedVideoGenerationEngine implements VideoGenerationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(SimulatedVideoGenerationEngine.class);

    @Override
    public Result generate(Request request, BooleanSupplier cancelled) throws GenerationException {
        if (request.imageUrl() == null || request.imageUrl().isBlank()) {
            throw new PermanentGenerationException("Video generation needs an image url");
        }
        if (cancelled.getAsBoolean()) {
            throw new PermanentGenerationException("Video generation cancelled");
        }
        String hash = Fingerprints.contentHash(request.imageUrl() + "|" + request.prompt());
        LOGGER.debug("VIDEO simulated sceneId={} hash={}", request.sceneId(), hash);
        return new Result("sim://videos/" + hash + ".mp4", "simulated", "sim-" + hash.substring(0, 12),
                Map.of("duration", request.durationSeconds()));
    }
}
