package com.example.mediagen_backend.service.cache;

import com.example.mediagen_backend.model.CacheEntry;

import java.util.Collection;
import java.util.List;

public class NoopCacheSnapshotStore implements CacheSnapshotStore {

    @Override
    public List<CacheEntry> load() {
        return List.of();
    }

    @Override
    public void save(Collection<CacheEntry> entries) {
        // nothing to persist
    }
}
