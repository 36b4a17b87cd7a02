package com.example.mediagen_backend.engine;

import com.example.mediagen_backend.engine.Interfaces.ImageGenerationEngine;
import com.example.mediagen_backend.util.Fingerprints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Local stand-in that answers with a URL derived from the request, so repeated requests map to
 * the same asset.
 */
public class SimulatedImageGenerationEngine implements ImageGenerationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(SimulatedImageGenerationEngine.class);

    @Override
    public Result generate(Request request) throws GenerationException {
        if (request.prompt() == null || request.prompt().isBlank()) {
            throw new PermanentGenerationException("Image prompt is empty");
        }
        String hash = Fingerprints.promptKey(request.prompt(), request.model());
        LOGGER.debug("IMAGE simulated sceneId={} hash={}", request.sceneId(), hash);
        return new Result("sim://images/" + hash + ".png", "simulated", Map.of("model", String.valueOf(request.model())));
    }
}
