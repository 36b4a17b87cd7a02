package com.example.mediagen_backend.engine;

import com.example.mediagen_backend.engine.Interfaces.AudioGenerationEngine;
import com.example.mediagen_backend.util.Fingerprints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

public class SimulatedAudioGenerationEngine implements AudioGenerationEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(SimulatedAudioGenerationEngine.class);

    @Override
    public Result generate(Request request) throws GenerationException {
        if (request.text() == null || request.text().isBlank()) {
            throw new PermanentGenerationException("Narration text is empty");
        }
        String hash = Fingerprints.contentHash(request.text() + "|" + request.voiceId());
        LOGGER.debug("AUDIO simulated sceneId={} hash={}", request.sceneId(), hash);
        return new Result("sim://audio/" + hash + ".mp3", "simulated", Map.of("characters", request.text().length()));
    }
}
