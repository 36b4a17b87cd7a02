package com.example.mediagen_backend.dto.pipeline;

import com.example.mediagen_backend.util.DispatchMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request payload for a pipeline run.
 */
public record ProjectConfig(
        @NotBlank String id,
        String title,
        @NotEmpty List<@Valid SceneData> scenes,
        String outputPath,
        Options optimizations
) {
    /**
     * Run options; missing values fall back to the pipeline defaults.
     */
    public record Options(Boolean enableCaching, Integer batchSize, Integer maxRetries, DispatchMode dispatchMode) {

        public boolean cachingEnabled() {
            return enableCaching == null || enableCaching;
        }

        public int resolvedBatchSize(int fallback) {
            return batchSize != null && batchSize > 0 ? batchSize : fallback;
        }

        public int resolvedMaxRetries(int fallback) {
            return maxRetries != null && maxRetries > 0 ? maxRetries : fallback;
        }

        public DispatchMode resolvedDispatchMode() {
            return dispatchMode == null ? DispatchMode.DIRECT : dispatchMode;
        }
    }

    public Options resolvedOptions() {
        return optimizations == null ? new Options(null, null, null, null) : optimizations;
    }
}
