package com.example.mediagen_backend.dto.pipeline;

public record GeneratedAsset(String sceneId, String url, double cost, boolean cached, int retryCount) {
}
