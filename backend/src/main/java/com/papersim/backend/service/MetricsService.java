package com.papersim.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final Map<String, Counter> riskExitsByReason = new ConcurrentHashMap<>();

    private Counter ordersPlacedCounter;
    private Counter ordersFilledCounter;
    private Counter ordersRejectedCounter;
    private Counter quoteFailuresCounter;
    private Counter cycleFailuresCounter;

    @PostConstruct
    void init() {
        ordersPlacedCounter = Counter.builder("orders_placed_total").register(meterRegistry);
        ordersFilledCounter = Counter.builder("orders_filled_total").register(meterRegistry);
        ordersRejectedCounter = Counter.builder("orders_rejected_total").register(meterRegistry);
        quoteFailuresCounter = Counter.builder("quote_failures_total").register(meterRegistry);
        cycleFailuresCounter = Counter.builder("scheduler_cycle_failures_total").register(meterRegistry);
    }

    public void recordOrderPlaced() {
        if (ordersPlacedCounter != null) {
            ordersPlacedCounter.increment();
        }
    }

    public void recordOrderFilled() {
        if (ordersFilledCounter != null) {
            ordersFilledCounter.increment();
        }
    }

    public void recordOrderRejected() {
        if (ordersRejectedCounter != null) {
            ordersRejectedCounter.increment();
        }
    }

    public void recordQuoteFailure() {
        if (quoteFailuresCounter != null) {
            quoteFailuresCounter.increment();
        }
    }

    public void recordCycleFailure() {
        if (cycleFailuresCounter != null) {
            cycleFailuresCounter.increment();
        }
    }

    public void recordRiskExit(String reason) {
        riskExitsByReason.computeIfAbsent(reason, key -> Counter.builder("risk_exits_total")
                        .tag("reason", key)
                        .register(meterRegistry))
                .increment();
    }
}
