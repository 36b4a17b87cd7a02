package com.example.mediagen_backend.service.scheduler;

@FunctionalInterface
public interface SchedulerEventListener {
    void onEvent(SchedulerEvent event);
}
