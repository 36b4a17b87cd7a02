package com.example.mediagen_backend.util;

/**
 * Scheduling priority of a job. Queues order by {@link #weight()} descending.
 */
public enum JobPriority {
    URGENT(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /**
     * One step lower, bottoming out at {@link #LOW}.
     */
    public JobPriority demote() {
        return switch (this) {
            case URGENT -> HIGH;
            case HIGH -> MEDIUM;
            case MEDIUM, LOW -> LOW;
        };
    }
}
