package com.papersim.backend.service;

import com.papersim.backend.config.SchedulerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Drives the price-refresh and order-monitor loops. Each loop reschedules itself after every run, so
 * the cadence follows the market session (faster during regular hours).
 */
@Service
@Slf4j
public class PaperTradingScheduler implements SmartLifecycle {

    private final SchedulerProperties properties;
    private final MarketSessionService marketSessionService;
    private final PriceRefreshService priceRefreshService;
    private final OrderMonitorService orderMonitorService;
    private final ScheduledTaskGuard taskGuard;

    private final Object lifecycleMonitor = new Object();
    private volatile boolean running;
    private volatile ScheduledThreadPoolExecutor executor;

    public PaperTradingScheduler(SchedulerProperties properties,
                                 MarketSessionService marketSessionService,
                                 PriceRefreshService priceRefreshService,
                                 OrderMonitorService orderMonitorService,
                                 ScheduledTaskGuard taskGuard) {
        this.properties = properties;
        this.marketSessionService = marketSessionService;
        this.priceRefreshService = priceRefreshService;
        this.orderMonitorService = orderMonitorService;
        this.taskGuard = taskGuard;
    }

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (running) {
                return;
            }
            executor = new ScheduledThreadPoolExecutor(2, new CustomizableThreadFactory("paper-scheduler-"));
            executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
            executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
            running = true;
            schedule(this::runPriceRefresh, Duration.ZERO);
            schedule(this::runOrderMonitor, Duration.ZERO);
            log.info("Paper trading scheduler started");
        }
    }

    /**
     * Stops rescheduling and waits, up to {@code scheduler.shutdown-timeout}, for in-flight cycles.
     */
    @Override
    public void stop() {
        ScheduledThreadPoolExecutor current;
        synchronized (lifecycleMonitor) {
            if (!running) {
                return;
            }
            running = false;
            current = executor;
            executor = null;
        }
        current.shutdown();
        try {
            if (!current.awaitTermination(properties.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Scheduler cycles still running after {}, interrupting", properties.getShutdownTimeout());
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.shutdownNow();
        }
        log.info("Paper trading scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStart();
    }

    Duration nextPriceRefreshDelay() {
        return marketSessionService.isRegularSessionOpen()
                ? properties.getPriceRefreshRegular()
                : properties.getPriceRefreshOffHours();
    }

    Duration nextOrderMonitorDelay() {
        return marketSessionService.isRegularSessionOpen()
                ? properties.getOrderMonitorRegular()
                : properties.getOrderMonitorOffHours();
    }

    private void runPriceRefresh() {
        taskGuard.run("price-refresh", priceRefreshService::refreshAll);
        schedule(this::runPriceRefresh, nextPriceRefreshDelay());
    }

    private void runOrderMonitor() {
        taskGuard.run("order-monitor", orderMonitorService::monitorPendingOrders);
        schedule(this::runOrderMonitor, nextOrderMonitorDelay());
    }

    private void schedule(Runnable task, Duration delay) {
        ScheduledThreadPoolExecutor current = executor;
        if (!running || current == null) {
            return;
        }
        try {
            current.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler shutting down, cycle not rescheduled");
        }
    }
}
