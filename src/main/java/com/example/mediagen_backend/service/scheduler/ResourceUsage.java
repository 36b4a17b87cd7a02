package com.example.mediagen_backend.service.scheduler;

public record ResourceUsage(long memoryMb, double costPerHour, int activeConnections) {
}
