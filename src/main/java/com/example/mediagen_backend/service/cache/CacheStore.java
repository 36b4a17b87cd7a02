package com.example.mediagen_backend.service.cache;

import com.example.mediagen_backend.config.CacheProperties;
import com.example.mediagen_backend.model.CacheEntry;
import com.example.mediagen_backend.util.CacheEntryKind;
import com.example.mediagen_backend.util.Fingerprints;
import com.example.mediagen_backend.util.PromptSimilarity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Size-bounded response cache for generation results.
 * <p>
 * Prompt entries are keyed by {@link Fingerprints#promptKey} and can be matched fuzzily by
 * token-set similarity within the same model. Media entries are keyed by the SHA-256 of their
 * content. When the total size passes the ceiling, the lowest-value entries are evicted until
 * it is back under the eviction target. All methods synchronize on the instance.
 */
@Service
public class CacheStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(CacheStore.class);
    private static final long SIZE_SCORE_SCALE = 1024L * 1024L;
    private static final int TOP_TAGS = 10;

    private final CacheProperties properties;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final CacheSnapshotStore snapshotStore;
    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();

    public CacheStore(CacheProperties properties, ObjectMapper mapper, Clock clock, CacheSnapshotStore snapshotStore) {
        this.properties = properties;
        this.mapper = mapper;
        this.clock = clock;
        this.snapshotStore = snapshotStore;
    }

    @PostConstruct
    public synchronized void restore() {
        Instant now = clock.instant();
        int loaded = 0;
        for (CacheEntry entry : snapshotStore.load()) {
            if (entry.getKey() != null && !entry.isExpired(now)) {
                entries.put(entry.getKey(), entry);
                loaded++;
            }
        }
        if (loaded > 0) {
            ensureSizeLimit();
            LOGGER.info("Cache restored entries={} sizeBytes={}", loaded, totalSize());
        }
    }

    /**
     * Caches a prompt response. Entries larger than the per-entry fraction of the ceiling are
     * skipped with a warning.
     *
     * @param ttl time to live; {@code null} uses the configured max age.
     * @return the entry key, or empty when the entry was too large.
     */
    public synchronized Optional<String> put(String prompt, String model, String provider, Object data, double cost,
                                             double quality, Set<String> tags, Duration ttl) {
        long size = sizeOf(data);
        long limit = (long) (properties.getMaxSizeBytes() * properties.getMaxEntryFraction());
        if (size > limit) {
            LOGGER.warn("Cache put skipped reason=too_large sizeBytes={} limitBytes={} model={}", size, limit, model);
            return Optional.empty();
        }
        Instant now = clock.instant();
        String key = Fingerprints.promptKey(prompt, model);
        CacheEntry entry = new CacheEntry();
        entry.setKey(key);
        entry.setKind(CacheEntryKind.PROMPT);
        entry.setData(data);
        entry.setTimestamp(now);
        entry.setLastAccessedAt(now);
        entry.setSize(size);
        entry.setTags(withLeadingTag("prompt", tags));
        entry.setExpiresAt(now.plus(ttl == null ? properties.getMaxAge() : ttl));
        entry.setPrompt(prompt);
        entry.setModel(model);
        entry.setProvider(provider);
        entry.setCost(cost);
        entry.setQuality(quality);
        entries.put(key, entry);
        LOGGER.debug("Cache put key={} model={} sizeBytes={} cost={}", key, model, size, cost);
        ensureSizeLimit();
        return Optional.of(key);
    }

    /**
     * Caches a media payload under the SHA-256 of its bytes.
     */
    public synchronized Optional<String> putMedia(String url, String mediaType, String format, byte[] content,
                                                  String resolution, Set<String> tags) {
        byte[] bytes = content == null ? new byte[0] : content;
        long size = bytes.length;
        long limit = (long) (properties.getMaxSizeBytes() * properties.getMaxMediaEntryFraction());
        if (size > limit) {
            LOGGER.warn("Cache putMedia skipped reason=too_large sizeBytes={} limitBytes={} url={}", size, limit, url);
            return Optional.empty();
        }
        Instant now = clock.instant();
        String key = Fingerprints.contentHash(bytes);
        Set<String> allTags = new LinkedHashSet<>();
        if (mediaType != null) {
            allTags.add(mediaType);
        }
        if (format != null) {
            allTags.add(format);
        }
        if (tags != null) {
            allTags.addAll(tags);
        }
        CacheEntry entry = new CacheEntry();
        entry.setKey(key);
        entry.setKind(CacheEntryKind.MEDIA);
        entry.setData(bytes);
        entry.setTimestamp(now);
        entry.setLastAccessedAt(now);
        entry.setSize(size);
        entry.setTags(allTags);
        entry.setExpiresAt(now.plus(properties.getMaxAge()));
        entry.setUrl(url);
        entry.setMediaType(mediaType);
        entry.setFormat(format);
        entry.setResolution(resolution);
        entry.setFileSize(size);
        entries.put(key, entry);
        ensureSizeLimit();
        return Optional.of(key);
    }

    public synchronized Optional<CacheHit> getExact(String key) {
        CacheEntry entry = live(key);
        if (entry == null || !entry.isPrompt()) {
            return Optional.empty();
        }
        touch(entry);
        return Optional.of(new CacheHit(entry.getKey(), entry.getData(), entry.getCost(), 1.0));
    }

    public Optional<CacheHit> getExact(String prompt, String model) {
        return getExact(Fingerprints.promptKey(prompt, model));
    }

    /**
     * Exact key first, then the most similar live prompt entry of the same model scoring at least
     * {@code threshold}. Ties go to the most recently created entry.
     */
    public synchronized Optional<CacheHit> getFuzzy(String prompt, String model, double threshold) {
        Optional<CacheHit> exact = getExact(prompt, model);
        if (exact.isPresent()) {
            return exact;
        }
        Instant now = clock.instant();
        CacheEntry best = null;
        double bestScore = -1;
        for (CacheEntry entry : entries.values()) {
            if (!entry.isPrompt() || entry.isExpired(now) || !Objects.equals(entry.getModel(), model)) {
                continue;
            }
            double score = PromptSimilarity.jaccard(prompt, entry.getPrompt());
            if (score < threshold) {
                continue;
            }
            if (score > bestScore || (score == bestScore && entry.getTimestamp().isAfter(best.getTimestamp()))) {
                best = entry;
                bestScore = score;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        touch(best);
        LOGGER.debug("Cache fuzzy hit key={} model={} similarity={}", best.getKey(), model, bestScore);
        return Optional.of(new CacheHit(best.getKey(), best.getData(), best.getCost(), bestScore));
    }

    public synchronized Optional<CacheEntry> getMedia(String contentHash) {
        CacheEntry entry = live(contentHash);
        if (entry == null || entry.getKind() != CacheEntryKind.MEDIA) {
            return Optional.empty();
        }
        touch(entry);
        return Optional.of(entry);
    }

    /**
     * Media entries of the given type scored by resolution match (0.4), format match (0.3) and
     * tag overlap (0.3). Only candidates scoring above 0.5 are returned, best first.
     */
    public synchronized List<MediaMatch> findSimilarMedia(String mediaType, String resolution, String format,
                                                          Collection<String> tags) {
        Instant now = clock.instant();
        List<MediaMatch> matches = new ArrayList<>();
        for (CacheEntry entry : entries.values()) {
            if (entry.getKind() != CacheEntryKind.MEDIA || entry.isExpired(now)
                    || !Objects.equals(entry.getMediaType(), mediaType)) {
                continue;
            }
            double score = 0;
            if (resolution != null && resolution.equals(entry.getResolution())) {
                score += 0.4;
            }
            if (format != null && format.equals(entry.getFormat())) {
                score += 0.3;
            }
            if (tags != null && !tags.isEmpty()) {
                long matching = tags.stream().filter(entry.getTags()::contains).count();
                score += ((double) matching / tags.size()) * 0.3;
            }
            if (score > 0.5) {
                matches.add(new MediaMatch(entry, score));
            }
        }
        matches.sort(Comparator.comparingDouble(MediaMatch::score).reversed());
        return matches;
    }

    public synchronized boolean evict(String key) {
        return entries.remove(key) != null;
    }

    public synchronized void clear() {
        int removed = entries.size();
        entries.clear();
        LOGGER.info("Cache cleared entries={}", removed);
    }

    /**
     * Evicts lowest-scoring entries while the cache is over its ceiling, down to the eviction
     * target ratio. Returns the number of entries removed.
     */
    public synchronized int ensureSizeLimit() {
        long total = totalSize();
        if (total <= properties.getMaxSizeBytes()) {
            return 0;
        }
        long target = (long) (properties.getMaxSizeBytes() * properties.getEvictionTargetRatio());
        Instant now = clock.instant();
        Map<String, Double> scores = new HashMap<>();
        entries.values().forEach(e -> scores.put(e.getKey(), removalScore(e, now)));
        List<CacheEntry> ordered = new ArrayList<>(entries.values());
        ordered.sort(Comparator.comparingDouble(e -> scores.get(e.getKey())));

        int removed = 0;
        for (CacheEntry entry : ordered) {
            if (total <= target) {
                break;
            }
            entries.remove(entry.getKey());
            total -= entry.getSize();
            removed++;
        }
        LOGGER.info("Cache eviction removed={} sizeBytes={} targetBytes={}", removed, total, target);
        return removed;
    }

    double removalScore(CacheEntry entry, Instant now) {
        double maxAgeMs = Math.max(1, properties.getMaxAge().toMillis());
        double ageMs = Math.max(0, Duration.between(entry.getTimestamp(), now).toMillis());
        double ageScore = Math.max(0, 1 - ageMs / maxAgeMs);
        double hitScore = Math.min(1, entry.getHits() / 10.0);
        double sizeScore = Math.max(0, 1 - (double) entry.getSize() / SIZE_SCORE_SCALE);
        double qualityScore = 1;
        double costScore = 1;
        if (entry.isPrompt()) {
            qualityScore = entry.getQuality() > 0 ? entry.getQuality() : 0.5;
            costScore = Math.min(1, entry.getCost() / 10);
        }
        return ageScore * 0.2 + hitScore * 0.3 + sizeScore * 0.2 + qualityScore * 0.15 + costScore * 0.15;
    }

    @Scheduled(fixedDelayString = "${cache.cleanup-interval:PT30M}", initialDelayString = "${cache.cleanup-interval:PT30M}")
    public void sweepExpired() {
        int removed;
        List<CacheEntry> snapshot;
        synchronized (this) {
            Instant now = clock.instant();
            removed = 0;
            Iterator<CacheEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            snapshot = List.copyOf(entries.values());
        }
        if (removed > 0) {
            LOGGER.info("Cache sweep removed={} remaining={}", removed, snapshot.size());
        }
        persist(snapshot);
    }

    public synchronized CacheStats stats() {
        Instant now = clock.instant();
        int prompts = 0;
        int media = 0;
        long size = 0;
        long hits = 0;
        double saved = 0;
        Instant oldest = null;
        Instant newest = null;
        int expiring = 0;
        Map<String, Long> tagCounts = new HashMap<>();
        for (CacheEntry entry : entries.values()) {
            if (entry.isPrompt()) {
                prompts++;
                saved += entry.getCost() * entry.getHits();
            } else {
                media++;
            }
            size += entry.getSize();
            hits += entry.getHits();
            if (oldest == null || entry.getTimestamp().isBefore(oldest)) {
                oldest = entry.getTimestamp();
            }
            if (newest == null || entry.getTimestamp().isAfter(newest)) {
                newest = entry.getTimestamp();
            }
            if (entry.getExpiresAt() != null && entry.getExpiresAt().isBefore(now.plus(Duration.ofHours(24)))) {
                expiring++;
            }
            entry.getTags().forEach(tag -> tagCounts.merge(tag, 1L, Long::sum));
        }
        List<CacheStats.TagCount> topTags = tagCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_TAGS)
                .map(e -> new CacheStats.TagCount(e.getKey(), e.getValue()))
                .toList();
        int total = entries.size();
        double utilization = properties.getMaxSizeBytes() == 0 ? 0 : (double) size / properties.getMaxSizeBytes();
        return new CacheStats(total, prompts, media, size, properties.getMaxSizeBytes(), utilization, hits,
                total == 0 ? 0 : (double) hits / total, saved, topTags, oldest, newest, expiring);
    }

    public synchronized long totalSize() {
        return entries.values().stream().mapToLong(CacheEntry::getSize).sum();
    }

    public synchronized int size() {
        return entries.size();
    }

    @PreDestroy
    public void flush() {
        List<CacheEntry> snapshot;
        synchronized (this) {
            snapshot = List.copyOf(entries.values());
        }
        persist(snapshot);
    }

    private void persist(List<CacheEntry> snapshot) {
        try {
            snapshotStore.save(snapshot);
        } catch (RuntimeException e) {
            LOGGER.warn("Cache snapshot save failed entries={} err={}", snapshot.size(), e.toString());
        }
    }

    private CacheEntry live(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private void touch(CacheEntry entry) {
        entry.setHits(entry.getHits() + 1);
        entry.setLastAccessedAt(clock.instant());
    }

    private long sizeOf(Object data) {
        if (data == null) {
            return 0;
        }
        if (data instanceof byte[] bytes) {
            return bytes.length;
        }
        if (data instanceof String text) {
            return text.getBytes(StandardCharsets.UTF_8).length;
        }
        try {
            return mapper.writeValueAsBytes(data).length;
        } catch (JsonProcessingException e) {
            return String.valueOf(data).getBytes(StandardCharsets.UTF_8).length;
        }
    }

    private static Set<String> withLeadingTag(String first, Set<String> tags) {
        Set<String> all = new LinkedHashSet<>();
        all.add(first);
        if (tags != null) {
            all.addAll(tags);
        }
        return all;
    }
}
