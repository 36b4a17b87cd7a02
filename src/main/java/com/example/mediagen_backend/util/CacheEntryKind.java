package com.example.mediagen_backend.util;

public enum CacheEntryKind {
    PROMPT,
    MEDIA
}
