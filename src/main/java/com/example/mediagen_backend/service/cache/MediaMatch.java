package com.example.mediagen_backend.service.cache;

import com.example.mediagen_backend.model.CacheEntry;

public record MediaMatch(CacheEntry entry, double score) {
}
