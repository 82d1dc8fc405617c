package com.papersim.backend.config;

import com.papersim.backend.service.MarketSessionService;
import com.papersim.backend.service.PaperTradingScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationFailedEvent;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Logs the root cause of a failed startup, and the market session and scheduler state once the
 * engine is ready.
 */
@Component
@Slf4j
public class StartupLifecycleListener implements ApplicationListener<ApplicationFailedEvent> {

    @Override
    public void onApplicationEvent(ApplicationFailedEvent event) {
        Throwable exception = event.getException();
        Throwable root = rootCause(exception);
        log.error("Paper trading engine failed to start. Root cause: {}", root.getMessage(), exception);
    }

    @Component
    @Slf4j
    @RequiredArgsConstructor
    public static class EngineReadyListener implements ApplicationListener<ApplicationReadyEvent> {

        private final MarketSessionService marketSessionService;
        private final PaperTradingScheduler scheduler;

        @Override
        public void onApplicationEvent(ApplicationReadyEvent event) {
            MarketSessionService.MarketSession session = marketSessionService.getMarketSession();
            log.info("Paper trading engine ready: market {} (next open {}, next close {}), scheduler {}",
                    session.status(), session.nextOpen(), session.nextClose(),
                    scheduler.isRunning() ? "running" : "stopped");
        }
    }

    static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}
