package com.papersim.backend.service;

import com.papersim.backend.config.ExecutionProperties;
import com.papersim.backend.model.PaperOrder.OrderSide;
import com.papersim.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Commission and slippage model. Deterministic: the same inputs always price the same way.
 */
@Service
@RequiredArgsConstructor
public class ExecutionCostModel {

    private final ExecutionProperties executionProperties;

    public BigDecimal commission(int quantity, BigDecimal price) {
        ExecutionProperties.Commission cfg = executionProperties.getCommission();
        BigDecimal notional = MoneyUtils.multiply(price, quantity);
        if (notional.compareTo(cfg.getThreshold()) < 0) {
            return MoneyUtils.scale(cfg.getBase());
        }
        return MoneyUtils.scale(cfg.getLarge());
    }

    /**
     * Slippage as a fraction of price, tiered by trade notional.
     */
    public BigDecimal slippage(BigDecimal notional) {
        ExecutionProperties.Slippage cfg = executionProperties.getSlippage();
        if (notional.compareTo(cfg.getMediumThreshold()) < 0) {
            return cfg.getSmall();
        }
        if (notional.compareTo(cfg.getLargeThreshold()) < 0) {
            return cfg.getMedium();
        }
        return cfg.getLarge();
    }

    /**
     * Rounds away from the trader at money scale: buys up, sells down.
     */
    public BigDecimal executionPrice(BigDecimal basePrice, OrderSide side, BigDecimal slippage) {
        if (side == OrderSide.BUY) {
            return basePrice.multiply(BigDecimal.ONE.add(slippage)).setScale(MoneyUtils.SCALE, RoundingMode.CEILING);
        }
        return basePrice.multiply(BigDecimal.ONE.subtract(slippage)).setScale(MoneyUtils.SCALE, RoundingMode.FLOOR);
    }

    /**
     * Full pricing of a fill of {@code quantity} shares quoted at {@code basePrice}.
     */
    public FillPrice price(BigDecimal basePrice, OrderSide side, int quantity) {
        BigDecimal slippage = slippage(MoneyUtils.multiply(basePrice, quantity));
        BigDecimal executionPrice = executionPrice(basePrice, side, slippage);
        BigDecimal commission = commission(quantity, executionPrice);
        return new FillPrice(basePrice, slippage, executionPrice, commission);
    }

    public record FillPrice(BigDecimal basePrice, BigDecimal slippage, BigDecimal executionPrice, BigDecimal commission) {}
}
