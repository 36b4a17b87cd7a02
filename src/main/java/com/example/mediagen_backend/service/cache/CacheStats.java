package com.example.mediagen_backend.service.cache;

import java.time.Instant;
import java.util.List;

public record CacheStats(int totalEntries,
                         int promptEntries,
                         int mediaEntries,
                         long totalSizeBytes,
                         long maxSizeBytes,
                         double utilization,
                         long totalHits,
                         double hitRate,
                         double costSaved,
                         List<TagCount> topTags,
                         Instant oldestEntry,
                         Instant newestEntry,
                         int expiringWithin24h) {

    public record TagCount(String tag, long count) {
    }
}
