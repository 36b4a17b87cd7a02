package com.example.mediagen_backend.util;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProgressStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
