package com.example.mediagen_backend.service.cache;

import com.example.mediagen_backend.model.CacheEntry;

import java.util.Collection;
import java.util.List;

/**
 * Persistence port for cache contents. The cache works purely in memory; a snapshot store lets it
 * survive restarts.
 */
public interface CacheSnapshotStore {

    List<CacheEntry> load();

    void save(Collection<CacheEntry> entries);
}
