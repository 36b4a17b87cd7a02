package com.example.mediagen_backend.service.cache;

/**
 * Result of a prompt lookup. {@code similarity} is 1.0 for exact key hits.
 */
public record CacheHit(String key, Object data, double cost, double similarity) {
}
