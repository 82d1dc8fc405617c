package com.papersim.backend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final MetricsService metricsService;

    /**
     * Runs one scheduler cycle. A failing cycle is logged and counted so the loop keeps going.
     */
    public void run(String taskName, Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            log.error("Scheduled task failed task={}", taskName, t);
            metricsService.recordCycleFailure();
        }
    }
}
