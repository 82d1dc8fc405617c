package com.papersim.backend.service;

import com.papersim.backend.config.ExecutionProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@Service
@Slf4j
public class AsyncDelayService {

    private final ExecutionProperties executionProperties;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "async-delay");
        thread.setDaemon(true);
        return thread;
    });

    public AsyncDelayService(ExecutionProperties executionProperties) {
        this.executionProperties = executionProperties;
    }

    /**
     * Blocks for a random execution latency drawn from the configured [min, max] millisecond range.
     */
    public Duration awaitExecutionLatency() {
        ExecutionProperties.Latency latency = executionProperties.getLatency();
        long min = Math.min(latency.getMinMillis(), latency.getMaxMillis());
        long max = Math.max(latency.getMinMillis(), latency.getMaxMillis());
        long millis = max == min ? min : ThreadLocalRandom.current().nextLong(min, max + 1);
        Duration delay = Duration.ofMillis(millis);
        await(delay);
        return delay;
    }

    public void await(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        scheduler.schedule(() -> future.complete(null), duration.toMillis(), TimeUnit.MILLISECONDS);
        future.join();
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
    }
}
