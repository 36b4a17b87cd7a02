package com.example.mediagen_backend.service.cache;

import com.example.mediagen_backend.config.CacheProperties;
import com.example.mediagen_backend.model.CacheEntry;
import com.example.mediagen_backend.util.CacheEntryKind;
import com.example.mediagen_backend.util.Fingerprints;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CacheStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private CacheProperties properties;
    private MutableClock clock;
    private CacheSnapshotStore snapshotStore;
    private CacheStore cache;

    @BeforeEach
    void setUp() {
        properties = new CacheProperties();
        properties.setMaxSizeBytes(1000);
        properties.setMaxEntryFraction(0.5);
        properties.setMaxMediaEntryFraction(0.5);
        properties.setEvictionTargetRatio(0.8);
        properties.setMaxAge(Duration.ofDays(7));
        clock = new MutableClock(T0);
        snapshotStore = mock(CacheSnapshotStore.class);
        cache = new CacheStore(properties, new ObjectMapper(), clock, snapshotStore);
    }

    private static String text(int bytes) {
        return "x".repeat(bytes);
    }

    @Test
    void exactLookupNormalizesPromptAndCountsHits() {
        Optional<String> key = cache.put("A red  fox", "dall-e-3", "openai", "https://cdn/fox.png", 0.04, 1.0,
                Set.of("scene-1"), null);

        Optional<CacheHit> hit = cache.getExact("  a RED fox ", "dall-e-3");

        assertThat(key).contains(Fingerprints.promptKey("a red fox", "dall-e-3"));
        assertThat(hit).isPresent();
        assertThat(hit.get().data()).isEqualTo("https://cdn/fox.png");
        assertThat(hit.get().similarity()).isEqualTo(1.0);
        assertThat(cache.getExact("a red fox", "other-model")).isEmpty();
        CacheStats stats = cache.stats();
        assertThat(stats.totalHits()).isEqualTo(1);
        assertThat(stats.costSaved()).isEqualTo(0.04);
        assertThat(stats.hitRate()).isEqualTo(1.0);
    }

    @Test
    void fuzzyLookupPrefersExactThenBestSimilarityWithinModel() {
        cache.put("sunset over the calm ocean", "m1", "p", "calm", 0.04, 1.0, Set.of(), null);
        cache.put("sunset over the ocean", "m2", "p", "other-model", 0.04, 1.0, Set.of(), null);
        cache.put("sunset over mountains", "m1", "p", "mountains", 0.04, 1.0, Set.of(), null);

        Optional<CacheHit> fuzzy = cache.getFuzzy("sunset over the ocean", "m1", 0.7);
        Optional<CacheHit> exact = cache.getFuzzy("sunset over mountains", "m1", 0.1);

        assertThat(fuzzy).isPresent();
        assertThat(fuzzy.get().data()).isEqualTo("calm");
        assertThat(fuzzy.get().similarity()).isEqualTo(0.8);
        assertThat(exact.get().data()).isEqualTo("mountains");
        assertThat(exact.get().similarity()).isEqualTo(1.0);
        assertThat(cache.getFuzzy("sunset over the ocean", "m1", 0.9)).isEmpty();
    }

    @Test
    void fuzzyTieGoesToNewestEntry() {
        cache.put("red fox forest", "m", "p", "older", 0.04, 1.0, Set.of(), null);
        clock.advance(Duration.ofSeconds(5));
        cache.put("red fox river", "m", "p", "newer", 0.04, 1.0, Set.of(), null);

        Optional<CacheHit> hit = cache.getFuzzy("red fox", "m", 0.5);

        assertThat(hit).map(CacheHit::data).contains("newer");
    }

    @Test
    void expiredEntriesAreDroppedOnAccess() {
        cache.put("a cat", "m", "p", "cat", 0.04, 1.0, Set.of(), Duration.ofMinutes(1));
        clock.advance(Duration.ofMinutes(2));

        assertThat(cache.getExact("a cat", "m")).isEmpty();
        assertThat(cache.getFuzzy("a cat", "m", 0.1)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void oversizedEntriesAreRejected() {
        assertThat(cache.put("big", "m", "p", text(501), 0.04, 1.0, Set.of(), null)).isEmpty();
        assertThat(cache.putMedia("u", "image", "png", new byte[501], "1024x1024", Set.of())).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void evictionBringsSizeUnderTargetAndKeepsPopularEntries() {
        cache.put("popular", "m", "p", text(300), 0.04, 1.0, Set.of(), null);
        for (int i = 0; i < 5; i++) {
            cache.getExact("popular", "m");
        }
        cache.put("two", "m", "p", text(300), 0.04, 1.0, Set.of(), null);
        cache.put("three", "m", "p", text(300), 0.04, 1.0, Set.of(), null);
        assertThat(cache.totalSize()).isEqualTo(900);

        cache.put("four", "m", "p", text(300), 0.04, 1.0, Set.of(), null);

        assertThat(cache.totalSize()).isLessThanOrEqualTo(800);
        assertThat(cache.getExact("popular", "m")).isPresent();
        assertThat(cache.getExact("four", "m")).isPresent();
        assertThat(cache.getExact("two", "m")).isEmpty();
        assertThat(cache.ensureSizeLimit()).isZero();
    }

    @Test
    void removalScoreFavoursFreshCheapSmallLowValueEntriesForEviction() {
        CacheEntry fresh = promptEntry(T0, 0, 100, 1.0, 5.0);
        CacheEntry stale = promptEntry(T0.minus(Duration.ofDays(6)), 0, 100, 1.0, 5.0);
        CacheEntry popular = promptEntry(T0, 10, 100, 1.0, 5.0);

        assertThat(cache.removalScore(stale, T0)).isLessThan(cache.removalScore(fresh, T0));
        assertThat(cache.removalScore(popular, T0)).isGreaterThan(cache.removalScore(fresh, T0));
    }

    @Test
    void mediaEntriesAreKeyedByContentAndMatchedBySimilarity() {
        byte[] exactBytes = "frame-a".getBytes(StandardCharsets.UTF_8);
        Optional<String> exactKey = cache.putMedia("https://cdn/a.png", "image", "png", exactBytes, "1024x1024",
                Set.of("scene-1"));
        cache.putMedia("https://cdn/b.png", "image", "png", "frame-b".getBytes(StandardCharsets.UTF_8), "512x512",
                Set.of("scene-1"));
        cache.putMedia("https://cdn/c.jpg", "image", "jpg", "frame-c".getBytes(StandardCharsets.UTF_8), "256x256",
                Set.of());
        cache.putMedia("https://cdn/d.mp3", "audio", "png", "frame-d".getBytes(StandardCharsets.UTF_8), "1024x1024",
                Set.of("scene-1"));

        List<MediaMatch> matches = cache.findSimilarMedia("image", "1024x1024", "png", List.of("scene-1"));

        assertThat(exactKey).contains(Fingerprints.contentHash(exactBytes));
        assertThat(cache.getMedia(exactKey.get())).map(CacheEntry::getUrl).contains("https://cdn/a.png");
        assertThat(matches).extracting(m -> m.entry().getUrl()).containsExactly("https://cdn/a.png", "https://cdn/b.png");
        assertThat(matches.get(0).score()).isEqualTo(1.0);
        assertThat(matches.get(1).score()).isEqualTo(0.6);
        assertThat(cache.getExact(exactKey.get())).isEmpty();
    }

    @Test
    void statsAggregateTagsAndKinds() {
        cache.put("one", "m", "p", "a", 1.0, 1.0, Set.of("scene-1", "image"), null);
        cache.put("two", "m", "p", "b", 1.0, 1.0, Set.of("scene-2", "image"), Duration.ofHours(1));
        cache.putMedia("u", "video", "mp4", new byte[10], "1080p", Set.of());
        cache.getExact("one", "m");
        cache.getExact("one", "m");

        CacheStats stats = cache.stats();

        assertThat(stats.totalEntries()).isEqualTo(3);
        assertThat(stats.promptEntries()).isEqualTo(2);
        assertThat(stats.mediaEntries()).isEqualTo(1);
        assertThat(stats.costSaved()).isEqualTo(2.0);
        assertThat(stats.expiringWithin24h()).isEqualTo(1);
        assertThat(stats.topTags().get(0)).isEqualTo(new CacheStats.TagCount("image", 2));
        assertThat(stats.topTags()).contains(new CacheStats.TagCount("prompt", 2));
        assertThat(stats.oldestEntry()).isEqualTo(T0);
    }

    @Test
    void sweepRemovesExpiredAndPersistsSnapshot() {
        cache.put("short", "m", "p", "s", 0.1, 1.0, Set.of(), Duration.ofMinutes(1));
        cache.put("long", "m", "p", "l", 0.1, 1.0, Set.of(), null);
        clock.advance(Duration.ofMinutes(5));

        cache.sweepExpired();

        assertThat(cache.size()).isEqualTo(1);
        verify(snapshotStore).save(any());
    }

    @Test
    void snapshotFailureDoesNotPropagate() {
        doThrow(new IllegalStateException("disk full")).when(snapshotStore).save(any());

        cache.flush();

        verify(snapshotStore).save(any());
    }

    @Test
    void restoreSkipsExpiredEntries() {
        CacheEntry live = promptEntry(T0, 1, 10, 1.0, 0.1);
        live.setKey("live");
        live.setExpiresAt(T0.plus(Duration.ofHours(1)));
        CacheEntry dead = promptEntry(T0.minus(Duration.ofDays(8)), 1, 10, 1.0, 0.1);
        dead.setKey("dead");
        dead.setExpiresAt(T0.minus(Duration.ofDays(1)));
        when(snapshotStore.load()).thenReturn(List.of(live, dead));

        cache.restore();

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.getExact("live")).isPresent();
    }

    @Test
    void evictAndClear() {
        Optional<String> key = cache.put("a", "m", "p", "a", 0.1, 1.0, Set.of(), null);
        cache.put("b", "m", "p", "b", 0.1, 1.0, Set.of(), null);

        assertThat(cache.evict(key.get())).isTrue();
        assertThat(cache.evict(key.get())).isFalse();
        cache.clear();
        assertThat(cache.size()).isZero();
    }

    private static CacheEntry promptEntry(Instant at, long hits, long size, double quality, double cost) {
        CacheEntry entry = new CacheEntry();
        entry.setKey(at + "-" + hits);
        entry.setKind(CacheEntryKind.PROMPT);
        entry.setTimestamp(at);
        entry.setLastAccessedAt(at);
        entry.setHits(hits);
        entry.setSize(size);
        entry.setQuality(quality);
        entry.setCost(cost);
        entry.setPrompt("p");
        entry.setModel("m");
        return entry;
    }
}
