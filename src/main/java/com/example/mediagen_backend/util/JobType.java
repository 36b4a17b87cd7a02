package com.example.mediagen_backend.util;

import java.util.Locale;

public enum JobType {
    IMAGE,
    AUDIO,
    VIDEO,
    SCRIPT;

    public static JobType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("job type is blank");
        }
        return JobType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
