package com.example.mediagen_backend.util;

public enum JobStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    NOT_FOUND
}
