package com.example.mediagen_backend.service.cache;

import com.example.mediagen_backend.model.CacheEntry;
import com.example.mediagen_backend.util.CacheEntryKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileCacheSnapshotStoreTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void savedEntriesLoadBack() {
        Path file = dir.resolve("nested/snapshot.json");
        JsonFileCacheSnapshotStore store = new JsonFileCacheSnapshotStore(mapper, file);
        CacheEntry entry = new CacheEntry();
        entry.setKey("k1");
        entry.setKind(CacheEntryKind.PROMPT);
        entry.setData("https://cdn/fox.png");
        entry.setTimestamp(Instant.parse("2024-05-01T10:00:00Z"));
        entry.setExpiresAt(Instant.parse("2024-05-08T10:00:00Z"));
        entry.setPrompt("a red fox");
        entry.setModel("dall-e-3");
        entry.setCost(0.04);
        entry.setHits(3);
        entry.setTags(new LinkedHashSet<>(List.of("prompt", "scene-1")));

        store.save(List.of(entry));
        List<CacheEntry> loaded = store.load();

        assertThat(Files.exists(file)).isTrue();
        assertThat(loaded).singleElement().satisfies(e -> {
            assertThat(e.getKey()).isEqualTo("k1");
            assertThat(e.isPrompt()).isTrue();
            assertThat(e.getPrompt()).isEqualTo("a red fox");
            assertThat(e.getData()).isEqualTo("https://cdn/fox.png");
            assertThat(e.getHits()).isEqualTo(3);
            assertThat(e.getTags()).containsExactly("prompt", "scene-1");
            assertThat(e.getExpiresAt()).isEqualTo(Instant.parse("2024-05-08T10:00:00Z"));
        });
    }

    @Test
    void missingOrCorruptFileLoadsEmpty() throws Exception {
        Path file = dir.resolve("snapshot.json");
        JsonFileCacheSnapshotStore store = new JsonFileCacheSnapshotStore(mapper, file);

        assertThat(store.load()).isEmpty();

        Files.writeString(file, "{not json");
        assertThat(store.load()).isEmpty();
    }
}
