package com.example.mediagen_backend.service.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingSchedulerEventListener implements SchedulerEventListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingSchedulerEventListener.class);

    @Override
    public void onEvent(SchedulerEvent event) {
        switch (event.type()) {
            case JOB_FAILED -> LOGGER.warn("scheduler event={} jobId={} type={} retries={} error={}",
                    event.type(), event.job().getId(), event.job().getType(), event.job().getRetryCount(), event.error());
            case RESOURCE_ALERT -> LOGGER.warn("scheduler event={} details={}", event.type(), event.details());
            default -> LOGGER.debug("scheduler event={} jobId={} type={} priority={}",
                    event.type(),
                    event.job() == null ? null : event.job().getId(),
                    event.job() == null ? null : event.job().getType(),
                    event.job() == null ? null : event.job().getPriority());
        }
    }
}
