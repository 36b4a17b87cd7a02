package com.example.mediagen_backend.config;

import com.example.mediagen_backend.service.cache.CacheSnapshotStore;
import com.example.mediagen_backend.service.cache.JsonFileCacheSnapshotStore;
import com.example.mediagen_backend.service.cache.NoopCacheSnapshotStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class CacheConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    CacheSnapshotStore cacheSnapshotStore(CacheProperties properties, ObjectMapper objectMapper) {
        if (!properties.getPersistence().isEnabled()) {
            return new NoopCacheSnapshotStore();
        }
        Path path = Path.of(properties.getPersistence().getPath());
        LOGGER.info("Cache snapshot store=json path={}", path.toAbsolutePath());
        return new JsonFileCacheSnapshotStore(objectMapper, path);
    }
}
