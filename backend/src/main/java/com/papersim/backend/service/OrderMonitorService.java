package com.papersim.backend.service;

import com.papersim.backend.market.QuoteService;
import com.papersim.backend.model.OrderStatus;
import com.papersim.backend.model.PaperOrder;
import com.papersim.backend.repository.PaperOrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Watches resting LIMIT, STOP and STOP_LIMIT orders. A triggered order waits out the simulated
 * execution latency and is then completed against a fresh quote.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OrderMonitorService {

    private final PaperOrderRepository orderRepository;
    private final QuoteService quoteService;
    private final OrderTriggerEvaluator triggerEvaluator;
    private final AsyncDelayService asyncDelayService;
    private final PaperOrderExecutionService executionService;
    private final MetricsService metricsService;

    /**
     * @return number of orders that reached a terminal state in this pass
     */
    public int monitorPendingOrders() {
        List<PaperOrder> pending = orderRepository.findByStatusAndOrderTypeNot(OrderStatus.PENDING,
                PaperOrder.OrderType.MARKET);
        int completed = 0;
        for (PaperOrder order : pending) {
            try {
                if (evaluate(order).filter(OrderStatus::isTerminal).isPresent()) {
                    completed++;
                }
            } catch (Exception e) {
                metricsService.recordCycleFailure();
                log.error("Order monitor failed for order {} ({})", order.getId(), order.getSymbol(), e);
            }
        }
        return completed;
    }

    /**
     * @return the order's status after this evaluation, or empty when it was deferred or not triggered
     */
    public Optional<OrderStatus> evaluate(PaperOrder order) {
        Optional<BigDecimal> price = quoteService.getPrice(order.getSymbol());
        if (price.isEmpty()) {
            log.debug("No quote for {}, order {} deferred", order.getSymbol(), order.getId());
            return Optional.empty();
        }
        if (!triggerEvaluator.isTriggered(order, price.get())) {
            return Optional.empty();
        }

        Duration delay = asyncDelayService.awaitExecutionLatency();
        Optional<BigDecimal> finalPrice = quoteService.getPrice(order.getSymbol());
        if (finalPrice.isEmpty()) {
            log.warn("Order {} triggered at {} but no quote after {} ms, deferring",
                    order.getId(), price.get(), delay.toMillis());
            return Optional.empty();
        }
        PaperOrder result = executionService.completeTriggeredOrder(order.getId(), finalPrice.get());
        return Optional.of(result.getStatus());
    }
}
