package com.example.mediagen_backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerExecutorConfigTest {

    private final WorkerExecutorConfig config = new WorkerExecutorConfig();

    @Test
    void workerPoolCoversEveryConcurrentJobSlot() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.setExecutorThreads(2);
        properties.setMaxConcurrentJobs(6);

        ThreadPoolTaskExecutor executor = config.workerTaskExecutor(properties);
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(6);
            assertThat(executor.getMaxPoolSize()).isEqualTo(6);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("worker-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void pipelineRunPoolIsSizedByConcurrentRuns() {
        PipelineProperties properties = new PipelineProperties();
        properties.setMaxConcurrentRuns(0);

        ThreadPoolTaskExecutor executor = config.pipelineRunExecutor(properties);
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(1);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void clockStampsInUtc() {
        assertThat(config.schedulerClock().getZone()).isEqualTo(ZoneOffset.UTC);
    }
}
