package com.example.mediagen_backend.service.scheduler;

import com.example.mediagen_backend.model.Job;
import com.example.mediagen_backend.util.JobType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BatchSelectorTest {

    private static final ResourceUsage IDLE = new ResourceUsage(0, 0, 0);

    private static Job job(String id, long memoryMb, double cost) {
        return Job.builder()
                .id(id)
                .type(JobType.IMAGE)
                .data(Map.of("memoryMb", memoryMb))
                .costEstimate(cost)
                .createdAt(Instant.EPOCH)
                .build();
    }

    private static long memoryOf(Job job) {
        return ((Number) job.getData().get("memoryMb")).longValue();
    }

    @Test
    void respectsSlotLimit() {
        BatchSelector selector = new BatchSelector(BatchSelectorTest::memoryOf, 1000, 100, true);
        List<Job> candidates = List.of(job("a", 10, 1), job("b", 10, 1), job("c", 10, 1));

        assertThat(selector.select(candidates, 2, IDLE)).extracting(Job::getId).containsExactly("a", "b");
    }

    @Test
    void skipsHeadJobThatDoesNotFitButKeepsOrderOfOthers() {
        BatchSelector selector = new BatchSelector(BatchSelectorTest::memoryOf, 100, 100, false);
        List<Job> candidates = List.of(job("big", 90, 1), job("small", 20, 1), job("tiny", 5, 1));

        assertThat(selector.select(candidates, 3, IDLE)).extracting(Job::getId).containsExactly("big", "tiny");
    }

    @Test
    void countsRunningUsageAgainstCeilings() {
        BatchSelector selector = new BatchSelector(BatchSelectorTest::memoryOf, 100, 10, true);
        List<Job> candidates = List.of(job("a", 30, 1), job("b", 30, 1));

        assertThat(selector.select(candidates, 5, new ResourceUsage(50, 0, 1))).extracting(Job::getId)
                .containsExactly("a");
        assertThat(selector.select(candidates, 5, new ResourceUsage(0, 9.5, 1))).isEmpty();
    }

    @Test
    void opportunisticFillAdmitsSmallJobsBeyondTheWindow() {
        BatchSelector strict = new BatchSelector(BatchSelectorTest::memoryOf, 100, 100, false);
        BatchSelector filling = new BatchSelector(BatchSelectorTest::memoryOf, 100, 100, true);
        List<Job> candidates = List.of(job("huge-1", 80, 1), job("huge-2", 80, 1), job("huge-3", 80, 1),
                job("huge-4", 80, 1), job("small", 10, 1));

        assertThat(strict.select(candidates, 2, IDLE)).extracting(Job::getId).containsExactly("huge-1");
        assertThat(filling.select(candidates, 2, IDLE)).extracting(Job::getId).containsExactly("huge-1", "small");
    }

    @Test
    void selectionNeverExceedsMemoryCeiling() {
        BatchSelector selector = new BatchSelector(BatchSelectorTest::memoryOf, 120, 100, true);
        List<Job> candidates = List.of(job("a", 50, 1), job("b", 50, 1), job("c", 50, 1), job("d", 15, 1));

        List<Job> selected = selector.select(candidates, 10, IDLE);

        assertThat(selected.stream().mapToLong(BatchSelectorTest::memoryOf).sum()).isLessThanOrEqualTo(120);
        assertThat(selected).extracting(Job::getId).containsExactly("a", "b", "d");
    }
}
