package com.example.mediagen_backend.controller;

import com.example.mediagen_backend.service.cache.CacheStats;
import com.example.mediagen_backend.service.cache.CacheStore;
import com.example.mediagen_backend.service.cache.MediaMatch;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/cache")
public class CacheController {
    private final CacheStore cache;

    public CacheController(CacheStore cache) {
        this.cache = cache;
    }

    public record LookupRes(String key, double similarity, double cost, Object data) {}
    public record MediaRes(String key, String url, String mediaType, String format, String resolution, long fileSize,
                           double score, Instant cachedAt) {}

    @GetMapping("/stats")
    public CacheStats stats() {
        return cache.stats();
    }

    @GetMapping("/lookup")
    public LookupRes lookup(@RequestParam String prompt,
                            @RequestParam String model,
                            @RequestParam(defaultValue = "1.0") double threshold) {
        if (threshold <= 0 || threshold > 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "THRESHOLD_OUT_OF_RANGE");
        }
        return cache.getFuzzy(prompt, model, threshold)
                .map(hit -> new LookupRes(hit.key(), hit.similarity(), hit.cost(), hit.data()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "CACHE_MISS"));
    }

    @GetMapping("/media/similar")
    public List<MediaRes> similarMedia(@RequestParam String mediaType,
                                       @RequestParam(required = false) String resolution,
                                       @RequestParam(required = false) String format,
                                       @RequestParam(required = false) List<String> tags) {
        return cache.findSimilarMedia(mediaType, resolution, format, tags).stream()
                .map(CacheController::toMediaRes)
                .toList();
    }

    @DeleteMapping("/{key}")
    public Map<String, Object> evict(@PathVariable String key) {
        if (!cache.evict(key)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "CACHE_KEY_NOT_FOUND");
        }
        return Map.of("key", key, "evicted", true);
    }

    @DeleteMapping
    public Map<String, Object> clear() {
        int before = cache.size();
        cache.clear();
        return Map.of("cleared", before);
    }

    private static MediaRes toMediaRes(MediaMatch match) {
        var e = match.entry();
        return new MediaRes(e.getKey(), e.getUrl(), e.getMediaType(), e.getFormat(), e.getResolution(),
                e.getFileSize(), match.score(), e.getTimestamp());
    }
}
