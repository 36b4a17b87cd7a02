package com.example.mediagen_backend.dto.pipeline;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

/**
 * One scene of a project: prompts for the image and video stages and the narration for audio.
 */
public record SceneData(
        @NotBlank String id,
        String title,
        String description,
        String narration,
        String imagePrompt,
        String videoPrompt,
        @Valid AudioSettings audioSettings,
        @Valid VideoSettings videoSettings
) {
    public record AudioSettings(String voiceId, String emotion, Double speed) {
    }

    public record VideoSettings(Integer duration, String cameraMovement, Integer motionIntensity) {
    }

    public String voiceIdOr(String fallback) {
        return audioSettings != null && audioSettings.voiceId() != null && !audioSettings.voiceId().isBlank()
                ? audioSettings.voiceId()
                : fallback;
    }

    public int durationOr(int fallback) {
        return videoSettings != null && videoSettings.duration() != null && videoSettings.duration() > 0
                ? videoSettings.duration()
                : fallback;
    }
}
