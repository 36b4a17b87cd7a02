package com.example.mediagen_backend.dto.pipeline;

/**
 * Returned when a run is started asynchronously.
 */
public record PipelineRunResponse(String runId, String status, double estimatedCost) {
}
