package com.example.mediagen_backend.model;

import java.time.Duration;
import java.util.Map;

/**
 * Outcome of one job inside a processor batch. {@code permanent} failures are not retried.
 */
public record JobResult(boolean success, Map<String, Object> data, String error, Duration duration, double cost,
                        boolean permanent) {

    public static JobResult ok(Map<String, Object> data, Duration duration, double cost) {
        return new JobResult(true, data == null ? Map.of() : data, null, duration, cost, false);
    }

    public static JobResult failure(String error, Duration duration) {
        return new JobResult(false, Map.of(), error, duration, 0, false);
    }

    public static JobResult permanentFailure(String error, Duration duration) {
        return new JobResult(false, Map.of(), error, duration, 0, true);
    }
}
