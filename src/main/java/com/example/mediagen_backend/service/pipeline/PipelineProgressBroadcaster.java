package com.example.mediagen_backend.service.pipeline;

import com.example.mediagen_backend.dto.pipeline.GenerationProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans progress events out to per-run subscribers. Delivery is at most once; a subscriber that
 * throws is dropped.
 */
@Component
public class PipelineProgressBroadcaster implements ProgressSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineProgressBroadcaster.class);

    private final Map<String, List<Consumer<GenerationProgress>>> subscribers = new ConcurrentHashMap<>();

    public Runnable subscribe(String runId, Consumer<GenerationProgress> consumer) {
        subscribers.computeIfAbsent(runId, id -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> unsubscribe(runId, consumer);
    }

    public void unsubscribe(String runId, Consumer<GenerationProgress> consumer) {
        subscribers.computeIfPresent(runId, (id, list) -> {
            list.remove(consumer);
            return list.isEmpty() ? null : list;
        });
    }

    public int subscriberCount(String runId) {
        List<Consumer<GenerationProgress>> list = subscribers.get(runId);
        return list == null ? 0 : list.size();
    }

    @Override
    public void emit(GenerationProgress event) {
        LOGGER.debug("progress runId={} stage={} sceneId={} status={} progress={}", event.runId(),
                event.stage() == null ? null : event.stage().label(), event.sceneId(), event.status(), event.progress());
        List<Consumer<GenerationProgress>> list = subscribers.get(event.runId());
        if (list == null) {
            return;
        }
        for (Consumer<GenerationProgress> consumer : list) {
            try {
                consumer.accept(event);
            } catch (RuntimeException e) {
                LOGGER.warn("Progress subscriber dropped runId={} err={}", event.runId(), e.toString());
                unsubscribe(event.runId(), consumer);
            }
        }
    }
}
