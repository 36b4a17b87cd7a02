package com.example.mediagen_backend.dto.pipeline;

public record CachingStats(int cacheHits, int cacheMisses, double costSaved) {
}
