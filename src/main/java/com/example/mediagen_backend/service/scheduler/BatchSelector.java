package com.example.mediagen_backend.service.scheduler;

import com.example.mediagen_backend.model.Job;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToLongFunction;

/**
 * Two-pass greedy batch selection under memory and cost-rate ceilings.
 * <p>
 * Pass one walks the head of the queue (twice the slot count) in priority order. Pass two,
 * when enabled, scans the rest of the runnable jobs smallest-footprint first and admits
 * anything that still fits. Both passes count already running work and jobs already picked.
 */
public class BatchSelector {

    private final ToLongFunction<Job> memoryOf;
    private final long maxMemoryMb;
    private final double maxCostPerHour;
    private final boolean opportunisticFill;

    public BatchSelector(ToLongFunction<Job> memoryOf, long maxMemoryMb, double maxCostPerHour,
                         boolean opportunisticFill) {
        this.memoryOf = memoryOf;
        this.maxMemoryMb = maxMemoryMb;
        this.maxCostPerHour = maxCostPerHour;
        this.opportunisticFill = opportunisticFill;
    }

    /**
     * @param candidates dependency-satisfied jobs in queue order.
     * @param limit free slots.
     * @param running usage of work already in flight.
     */
    public List<Job> select(List<Job> candidates, int limit, ResourceUsage running) {
        List<Job> selected = new ArrayList<>();
        if (limit <= 0 || candidates.isEmpty()) {
            return selected;
        }
        long memory = running.memoryMb();
        double cost = running.costPerHour();

        List<Job> window = candidates.subList(0, Math.min(limit * 2, candidates.size()));
        for (Job job : window) {
            if (selected.size() >= limit) {
                break;
            }
            long jobMemory = memoryOf.applyAsLong(job);
            double jobCost = costOf(job);
            if (fits(memory + jobMemory, cost + jobCost)) {
                selected.add(job);
                memory += jobMemory;
                cost += jobCost;
            }
        }

        if (opportunisticFill && selected.size() < limit) {
            List<Job> remaining = new ArrayList<>(candidates);
            remaining.removeAll(selected);
            remaining.sort(Comparator.comparingLong(memoryOf));
            for (Job job : remaining) {
                if (selected.size() >= limit) {
                    break;
                }
                long jobMemory = memoryOf.applyAsLong(job);
                double jobCost = costOf(job);
                if (fits(memory + jobMemory, cost + jobCost)) {
                    selected.add(job);
                    memory += jobMemory;
                    cost += jobCost;
                }
            }
        }
        return selected;
    }

    static double costOf(Job job) {
        return job.getCostEstimate() > 0 ? job.getCostEstimate() : 1.0;
    }

    private boolean fits(long memory, double cost) {
        return memory <= maxMemoryMb && cost <= maxCostPerHour;
    }
}
