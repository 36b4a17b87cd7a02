package com.example.mediagen_backend.model;

import java.time.Instant;
import java.util.Map;

/**
 * Input to {@link JobTransitions}. Only the fields relevant for the given {@link Type} are read.
 */
public record JobEvent(Type type, Instant at, String error, Map<String, Object> result, double cost) {

    public enum Type {
        DEPENDENCIES_PENDING,
        DEPENDENCIES_SATISFIED,
        STARTED,
        SUCCEEDED,
        ATTEMPT_FAILED,
        REQUEUED,
        FAILED,
        CANCEL_REQUESTED
    }

    public static JobEvent dependenciesPending() {
        return new JobEvent(Type.DEPENDENCIES_PENDING, null, null, null, 0);
    }

    public static JobEvent dependenciesSatisfied() {
        return new JobEvent(Type.DEPENDENCIES_SATISFIED, null, null, null, 0);
    }

    public static JobEvent started(Instant at) {
        return new JobEvent(Type.STARTED, at, null, null, 0);
    }

    public static JobEvent succeeded(Instant at, Map<String, Object> result, double cost) {
        return new JobEvent(Type.SUCCEEDED, at, null, result, cost);
    }

    public static JobEvent attemptFailed(String error) {
        return new JobEvent(Type.ATTEMPT_FAILED, null, error, null, 0);
    }

    public static JobEvent requeued() {
        return new JobEvent(Type.REQUEUED, null, null, null, 0);
    }

    public static JobEvent failed(Instant at, String error) {
        return new JobEvent(Type.FAILED, at, error, null, 0);
    }

    public static JobEvent cancelRequested() {
        return new JobEvent(Type.CANCEL_REQUESTED, null, "Cancelled by user", null, 0);
    }
}
