package com.papersim.backend.service;

import com.papersim.backend.config.ExecutionProperties;
import com.papersim.backend.dto.PlaceOrderRequest;
import com.papersim.backend.exception.TradingErrorCode;
import com.papersim.backend.exception.TradingException;
import com.papersim.backend.market.QuoteService;
import com.papersim.backend.model.OrderStatus;
import com.papersim.backend.model.PaperAccount;
import com.papersim.backend.model.PaperOrder;
import com.papersim.backend.model.PaperOrder.OrderSide;
import com.papersim.backend.model.PaperOrder.OrderType;
import com.papersim.backend.model.PaperPosition;
import com.papersim.backend.repository.PaperAccountRepository;
import com.papersim.backend.repository.PaperOrderRepository;
import com.papersim.backend.repository.PaperPositionRepository;
import com.papersim.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Order engine. Every mutating path locks the account row first and the order row second.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PaperOrderExecutionService {

    private final PaperAccountRepository accountRepository;
    private final PaperOrderRepository orderRepository;
    private final PaperPositionRepository positionRepository;
    private final QuoteService quoteService;
    private final MarketSessionService marketSessionService;
    private final ExecutionCostModel costModel;
    private final PositionLedger positionLedger;
    private final AccountAggregator accountAggregator;
    private final OrderTriggerEvaluator triggerEvaluator;
    private final ExecutionProperties executionProperties;
    private final MetricsService metricsService;
    private final Clock clock;

    @Transactional
    public PaperOrder placeOrder(PlaceOrderRequest request) {
        validateShape(request);
        String symbol = normalizeSymbol(request.getSymbol());
        int quantity = request.getQuantity();

        BigDecimal quotePrice = quoteService.getPrice(symbol)
                .orElseThrow(() -> TradingException.quoteUnavailable(symbol));

        PaperAccount account = lockAccount(request.getAccountId());
        if (!account.isActive()) {
            throw TradingException.validation("Paper account is inactive: " + account.getId());
        }
        if (request.getOrderType() == OrderType.MARKET && !marketSessionService.isRegularSessionOpen()) {
            throw new TradingException(TradingErrorCode.MARKET_CLOSED,
                    "Market orders can only be placed during regular market hours");
        }

        BigDecimal estimatedPrice = request.getPrice() != null ? request.getPrice() : quotePrice;
        BigDecimal commission = costModel.commission(quantity, estimatedPrice);
        if (request.getSide() == OrderSide.BUY) {
            BigDecimal required = MoneyUtils.add(MoneyUtils.multiply(estimatedPrice, quantity), commission);
            BigDecimal spendable = MoneyUtils.multiply(account.getAvailableCash(),
                    executionProperties.getOrders().getMaxCashUsage());
            if (required.compareTo(spendable) > 0) {
                throw new TradingException(TradingErrorCode.INSUFFICIENT_FUNDS,
                        "Insufficient funds. Required: " + MoneyUtils.usd(required)
                                + ", Available: " + MoneyUtils.usd(spendable));
            }
        } else {
            int held = positionRepository.findByAccountIdAndSymbol(account.getId(), symbol)
                    .map(PaperPosition::getQuantity)
                    .orElse(0);
            if (held < quantity) {
                throw new TradingException(TradingErrorCode.INSUFFICIENT_SHARES,
                        "Insufficient shares. Required: " + quantity + ", Available: " + held);
            }
        }

        PaperOrder order = orderRepository.save(PaperOrder.builder()
                .accountId(account.getId())
                .symbol(symbol)
                .orderType(request.getOrderType())
                .side(request.getSide())
                .quantity(quantity)
                .price(request.getPrice())
                .stopPrice(request.getStopPrice())
                .status(OrderStatus.PENDING)
                .filledQuantity(0)
                .commission(commission)
                .notes(request.getNotes())
                .build());
        metricsService.recordOrderPlaced();
        log.info("Placed {} {} order {} for {} x{} on account {}", order.getOrderType(), order.getSide(),
                order.getId(), symbol, quantity, account.getId());

        if (order.getOrderType() == OrderType.MARKET) {
            executeMarketFill(account, order);
        }
        return order;
    }

    /**
     * Fills a pending market order at the current quote. Returns the order unchanged when it is no
     * longer pending.
     */
    @Transactional
    public PaperOrder fillMarketOrder(Long orderId) {
        PaperAccount account = lockAccount(owningAccountId(orderId));
        PaperOrder order = lockOrder(orderId);
        if (!order.getStatus().canTransitionTo(OrderStatus.FILLED)) {
            log.debug("Order {} already {}, skipping fill", orderId, order.getStatus());
            return order;
        }
        executeMarketFill(account, order);
        return order;
    }

    /**
     * Completes a triggered LIMIT, STOP or STOP_LIMIT order at {@code finalPrice}, the quote taken
     * after the execution delay. A STOP_LIMIT whose limit no longer holds, or a fill the account can
     * no longer cover, moves the order to REJECTED.
     */
    @Transactional
    public PaperOrder completeTriggeredOrder(Long orderId, BigDecimal finalPrice) {
        PaperAccount account = lockAccount(owningAccountId(orderId));
        PaperOrder order = lockOrder(orderId);
        if (!order.getStatus().canTransitionTo(OrderStatus.FILLED)) {
            log.debug("Order {} already {}, skipping trigger", orderId, order.getStatus());
            return order;
        }

        if (order.getOrderType() == OrderType.STOP_LIMIT && !triggerEvaluator.limitConditionMet(order, finalPrice)) {
            return reject(order, "Stop triggered at " + MoneyUtils.usd(finalPrice)
                    + " but limit price " + MoneyUtils.usd(order.getPrice()) + " not met");
        }

        ExecutionCostModel.FillPrice fill = costModel.price(finalPrice, order.getSide(), order.getQuantity());
        if (order.isBuy()) {
            BigDecimal cost = MoneyUtils.add(MoneyUtils.multiply(fill.executionPrice(), order.getQuantity()),
                    fill.commission());
            if (cost.compareTo(account.getAvailableCash()) > 0) {
                return reject(order, "Insufficient funds at execution. Required: " + MoneyUtils.usd(cost)
                        + ", Available: " + MoneyUtils.usd(account.getAvailableCash()));
            }
        } else {
            int held = positionRepository.findByAccountIdAndSymbol(account.getId(), order.getSymbol())
                    .map(PaperPosition::getQuantity)
                    .orElse(0);
            if (held < order.getQuantity()) {
                return reject(order, "Insufficient shares at execution. Required: " + order.getQuantity()
                        + ", Available: " + held);
            }
        }

        completeFill(account, order, fill, triggeredDescription(order, fill, finalPrice));
        return order;
    }

    @Transactional
    public PaperOrder cancelOrder(Long orderId) {
        lockAccount(owningAccountId(orderId));
        PaperOrder order = lockOrder(orderId);
        if (!order.getStatus().canTransitionTo(OrderStatus.CANCELLED)) {
            throw new TradingException(TradingErrorCode.CANNOT_CANCEL,
                    "Order " + orderId + " cannot be cancelled in status " + order.getStatus());
        }
        if (!marketSessionService.isRegularSessionOpen()) {
            throw new TradingException(TradingErrorCode.CANNOT_CANCEL,
                    "Orders can only be cancelled during regular market hours");
        }
        moveTo(order, OrderStatus.CANCELLED);
        orderRepository.save(order);
        log.info("Cancelled order {} ({} {} x{})", orderId, order.getSide(), order.getSymbol(), order.getQuantity());
        return order;
    }

    private void executeMarketFill(PaperAccount account, PaperOrder order) {
        BigDecimal basePrice = quoteService.getPrice(order.getSymbol())
                .orElseThrow(() -> TradingException.quoteUnavailable(order.getSymbol()));
        ExecutionCostModel.FillPrice fill = costModel.price(basePrice, order.getSide(), order.getQuantity());
        String description = String.format(Locale.US, "%s %d shares of %s at %s (slippage: %s%%)",
                order.getSide(), order.getQuantity(), order.getSymbol(), MoneyUtils.usd(fill.executionPrice()),
                fill.slippage().multiply(MoneyUtils.HUNDRED).setScale(2, RoundingMode.HALF_UP).toPlainString());
        completeFill(account, order, fill, description);
    }

    private void completeFill(PaperAccount account, PaperOrder order, ExecutionCostModel.FillPrice fill,
                              String description) {
        positionLedger.applyFill(account, order.getId(), order.getSymbol(), order.getSide(), order.getQuantity(),
                fill.executionPrice(), fill.commission(), description);

        moveTo(order, OrderStatus.FILLED);
        order.setFilledQuantity(order.getQuantity());
        order.setAveragePrice(fill.executionPrice());
        order.setCommission(fill.commission());
        order.setFilledAt(LocalDateTime.now(clock));
        orderRepository.save(order);

        accountAggregator.recompute(account);
        metricsService.recordOrderFilled();
        log.info("Filled order {}: {}", order.getId(), description);
    }

    private PaperOrder reject(PaperOrder order, String note) {
        moveTo(order, OrderStatus.REJECTED);
        order.setNotes(note);
        orderRepository.save(order);
        metricsService.recordOrderRejected();
        log.info("Rejected order {}: {}", order.getId(), note);
        return order;
    }

    private static void moveTo(PaperOrder order, OrderStatus target) {
        if (!order.getStatus().canTransitionTo(target)) {
            throw new IllegalStateException("Order " + order.getId() + " cannot move from "
                    + order.getStatus() + " to " + target);
        }
        order.setStatus(target);
    }

    private String triggeredDescription(PaperOrder order, ExecutionCostModel.FillPrice fill, BigDecimal finalPrice) {
        String base = String.format(Locale.US, "%s shares of %s at %s", order.getQuantity(), order.getSymbol(),
                MoneyUtils.usd(fill.executionPrice()));
        return switch (order.getOrderType()) {
            case LIMIT -> "LIMIT " + order.getSide() + " " + base + " (triggered at " + MoneyUtils.usd(finalPrice) + ")";
            case STOP -> "STOP " + order.getSide() + " " + base + " (triggered at " + MoneyUtils.usd(finalPrice) + ")";
            case STOP_LIMIT -> "STOP-LIMIT " + order.getSide() + " " + base + " (stop: "
                    + MoneyUtils.usd(order.getStopPrice()) + ", limit: " + MoneyUtils.usd(order.getPrice()) + ")";
            case MARKET -> order.getSide() + " " + base;
        };
    }

    private void validateShape(PlaceOrderRequest request) {
        if (request == null) {
            throw TradingException.validation("Order request is required");
        }
        ExecutionProperties.Orders limits = executionProperties.getOrders();
        Integer quantity = request.getQuantity();
        if (quantity == null || quantity < limits.getMinQuantity() || quantity > limits.getMaxQuantity()) {
            throw TradingException.validation("Quantity must be between " + limits.getMinQuantity()
                    + " and " + limits.getMaxQuantity());
        }
        if (request.getAccountId() == null) {
            throw TradingException.validation("Account id is required");
        }
        if (request.getSymbol() == null || request.getSymbol().isBlank()) {
            throw TradingException.validation("Symbol is required");
        }
        if (request.getOrderType() == null || request.getSide() == null) {
            throw TradingException.validation("Order type and side are required");
        }
        OrderType type = request.getOrderType();
        if ((type == OrderType.LIMIT || type == OrderType.STOP_LIMIT) && !isPositive(request.getPrice())) {
            throw TradingException.validation(type + " orders require a positive limit price");
        }
        if ((type == OrderType.STOP || type == OrderType.STOP_LIMIT) && !isPositive(request.getStopPrice())) {
            throw TradingException.validation(type + " orders require a positive stop price");
        }
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    static String normalizeSymbol(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    private PaperAccount lockAccount(Long accountId) {
        return accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> TradingException.accountNotFound(accountId));
    }

    private Long owningAccountId(Long orderId) {
        return orderRepository.findAccountIdById(orderId)
                .orElseThrow(() -> orderNotFound(orderId));
    }

    private PaperOrder lockOrder(Long orderId) {
        return orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> orderNotFound(orderId));
    }

    private static TradingException orderNotFound(Long orderId) {
        return new TradingException(TradingErrorCode.ORDER_NOT_FOUND, "Order not found: " + orderId);
    }
}
