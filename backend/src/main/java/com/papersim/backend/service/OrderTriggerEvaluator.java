package com.papersim.backend.service;

import com.papersim.backend.model.PaperOrder;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Price conditions for resting orders.
 *
 * <pre>
 * LIMIT  BUY  price &lt;= limit     LIMIT  SELL price &gt;= limit
 * STOP   BUY  price &gt;= stop      STOP   SELL price &lt;= stop
 * STOP_LIMIT  triggers on the stop condition, fills only if the limit condition also holds
 * </pre>
 */
@Component
public class OrderTriggerEvaluator {

    public boolean isTriggered(PaperOrder order, BigDecimal currentPrice) {
        return switch (order.getOrderType()) {
            case MARKET -> true;
            case LIMIT -> limitConditionMet(order, currentPrice);
            case STOP, STOP_LIMIT -> stopConditionMet(order, currentPrice);
        };
    }

    public boolean limitConditionMet(PaperOrder order, BigDecimal currentPrice) {
        if (order.getPrice() == null || currentPrice == null) {
            return false;
        }
        int cmp = currentPrice.compareTo(order.getPrice());
        return order.isBuy() ? cmp <= 0 : cmp >= 0;
    }

    public boolean stopConditionMet(PaperOrder order, BigDecimal currentPrice) {
        if (order.getStopPrice() == null || currentPrice == null) {
            return false;
        }
        int cmp = currentPrice.compareTo(order.getStopPrice());
        return order.isBuy() ? cmp >= 0 : cmp <= 0;
    }
}
