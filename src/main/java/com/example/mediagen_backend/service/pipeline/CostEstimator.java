package com.example.mediagen_backend.service.pipeline;

import com.example.mediagen_backend.config.PipelineProperties;
import com.example.mediagen_backend.dto.pipeline.ProjectConfig;
import com.example.mediagen_backend.dto.pipeline.SceneData;
import org.springframework.stereotype.Component;

/**
 * Caller-side price estimates per asset. Not authoritative; used for budgeting and for the
 * savings reported on cache hits.
 */
@Component
public class CostEstimator {

    private final PipelineProperties properties;

    public CostEstimator(PipelineProperties properties) {
        this.properties = properties;
    }

    public double image(SceneData scene) {
        return properties.getPricing().getImagePerCall();
    }

    public double audio(SceneData scene) {
        int characters = scene.narration() == null ? 0 : scene.narration().length();
        return characters * properties.getPricing().getAudioPerCharacter();
    }

    public double video(SceneData scene) {
        return scene.durationOr(properties.getDefaultVideoDurationSeconds()) * properties.getPricing().getVideoPerSecond();
    }

    public double project(ProjectConfig config) {
        double total = 0;
        for (SceneData scene : config.scenes()) {
            total += image(scene) + audio(scene) + video(scene);
        }
        return total;
    }
}
