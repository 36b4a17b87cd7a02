package com.example.mediagen_backend.util;

/**
 * How the orchestrator issues provider calls for a stage.
 * DIRECT calls providers from its own fan-out pool with a retry wrapper; SCHEDULER submits
 * one job per scene to the batch scheduler and lets it retry.
 */
public enum DispatchMode {
    DIRECT,
    SCHEDULER
}
