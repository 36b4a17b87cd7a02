package com.example.mediagen_backend.config;

import com.example.mediagen_backend.repository.JobHistoryRepository;
import com.example.mediagen_backend.service.scheduler.InMemoryJobHistoryStore;
import com.example.mediagen_backend.service.scheduler.JobHistoryStore;
import com.example.mediagen_backend.service.scheduler.JpaJobHistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JobHistoryConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobHistoryConfig.class);

    @Bean
    JobHistoryStore jobHistoryStore(SchedulerProperties properties, JobHistoryRepository repository) {
        if (properties.getHistory().isPersistent()) {
            LOGGER.info("Job history store=jpa");
            return new JpaJobHistoryStore(repository);
        }
        LOGGER.info("Job history store=in-memory capacity={}", properties.getHistoryLimit());
        return new InMemoryJobHistoryStore(properties.getHistoryLimit());
    }
}
