package com.example.mediagen_backend.service.cache;

import com.example.mediagen_backend.model.CacheEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Writes the cache as a JSON array to a single file, replacing it atomically via a temp file.
 */
public class JsonFileCacheSnapshotStore implements CacheSnapshotStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileCacheSnapshotStore.class);
    private static final TypeReference<List<CacheEntry>> ENTRIES = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final Path path;

    public JsonFileCacheSnapshotStore(ObjectMapper mapper, Path path) {
        this.mapper = mapper;
        this.path = path;
    }

    @Override
    public List<CacheEntry> load() {
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            List<CacheEntry> entries = mapper.readValue(path.toFile(), ENTRIES);
            LOGGER.info("Cache snapshot loaded path={} entries={}", path, entries.size());
            return entries;
        } catch (IOException e) {
            LOGGER.warn("Cache snapshot unreadable path={} err={}", path, e.toString());
            return List.of();
        }
    }

    @Override
    public void save(Collection<CacheEntry> entries) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), new ArrayList<>(entries));
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOGGER.debug("Cache snapshot saved path={} entries={}", path, entries.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Cache snapshot write failed: " + path, e);
        }
    }
}
