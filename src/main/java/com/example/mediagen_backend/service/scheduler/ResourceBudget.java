package com.example.mediagen_backend.service.scheduler;

/**
 * Admission-control counters shared by every caller of one scheduler. Every
 * {@link #reserve} is paired with exactly one {@link #release} of the returned reservation.
 */
public class ResourceBudget {

    public record Reservation(long memoryMb, double costPerHour, int connections) {
    }

    private long memoryMb;
    private double costPerHour;
    private int activeConnections;

    public synchronized Reservation reserve(long memory, double cost, int connections) {
        memoryMb += memory;
        costPerHour += cost;
        activeConnections += connections;
        return new Reservation(memory, cost, connections);
    }

    public synchronized void release(Reservation reservation) {
        memoryMb = Math.max(0, memoryMb - reservation.memoryMb());
        costPerHour = Math.max(0, costPerHour - reservation.costPerHour());
        activeConnections = Math.max(0, activeConnections - reservation.connections());
    }

    public synchronized ResourceUsage snapshot() {
        return new ResourceUsage(memoryMb, costPerHour, activeConnections);
    }

    public synchronized int activeConnections() {
        return activeConnections;
    }
}
