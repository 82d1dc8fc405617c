package com.papersim.backend.service;

import com.papersim.backend.config.ExecutionProperties;
import com.papersim.backend.model.PaperOrder.OrderSide;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionCostModelTest {

    private final ExecutionCostModel costModel = new ExecutionCostModel(new ExecutionProperties());

    @Test
    void commissionSwitchesToLargeFeeAtThreshold() {
        assertThat(costModel.commission(1, new BigDecimal("999.99"))).isEqualByComparingTo("0.99");
        assertThat(costModel.commission(10, new BigDecimal("100"))).isEqualByComparingTo("9.99");
        assertThat(costModel.commission(1, new BigDecimal("1000.01"))).isEqualByComparingTo("9.99");
    }

    @Test
    void slippageIsTieredByNotional() {
        assertThat(costModel.slippage(new BigDecimal("9999.99"))).isEqualByComparingTo("0.001");
        assertThat(costModel.slippage(new BigDecimal("10000"))).isEqualByComparingTo("0.002");
        assertThat(costModel.slippage(new BigDecimal("99999.99"))).isEqualByComparingTo("0.002");
        assertThat(costModel.slippage(new BigDecimal("100000"))).isEqualByComparingTo("0.005");
    }

    @Test
    void slippageAlwaysMovesAgainstTheTrader() {
        ExecutionCostModel.FillPrice buy = costModel.price(new BigDecimal("100"), OrderSide.BUY, 10);
        ExecutionCostModel.FillPrice sell = costModel.price(new BigDecimal("100"), OrderSide.SELL, 10);

        assertThat(buy.executionPrice()).isEqualByComparingTo("100.1");
        assertThat(sell.executionPrice()).isEqualByComparingTo("99.9");
        assertThat(buy.executionPrice()).isGreaterThan(buy.basePrice());
        assertThat(sell.executionPrice()).isLessThan(sell.basePrice());
    }

    @Test
    void subCentQuotesRoundAgainstTheTrader() {
        ExecutionCostModel.FillPrice buy = costModel.price(new BigDecimal("0.01231"), OrderSide.BUY, 100);
        ExecutionCostModel.FillPrice sell = costModel.price(new BigDecimal("0.01239"), OrderSide.SELL, 100);

        assertThat(buy.executionPrice()).isEqualByComparingTo("0.0124");
        assertThat(sell.executionPrice()).isEqualByComparingTo("0.0123");
        assertThat(buy.executionPrice()).isGreaterThan(buy.basePrice());
        assertThat(sell.executionPrice()).isLessThan(sell.basePrice());
    }

    @Test
    void exactProductsAreNotNudged() {
        assertThat(costModel.executionPrice(new BigDecimal("94"), OrderSide.BUY, new BigDecimal("0.001")))
                .isEqualByComparingTo("94.094");
        assertThat(costModel.executionPrice(new BigDecimal("49"), OrderSide.SELL, new BigDecimal("0.001")))
                .isEqualByComparingTo("48.951");
    }

    @Test
    void commissionIsChargedOnExecutionPrice() {
        // 10 x 99.9 = 999 after sell slippage, below the threshold
        ExecutionCostModel.FillPrice sell = costModel.price(new BigDecimal("100"), OrderSide.SELL, 10);
        ExecutionCostModel.FillPrice buy = costModel.price(new BigDecimal("100"), OrderSide.BUY, 10);

        assertThat(sell.commission()).isEqualByComparingTo("0.99");
        assertThat(buy.commission()).isEqualByComparingTo("9.99");
    }

    @Test
    void largeTradesUseLargestSlippageTier() {
        ExecutionCostModel.FillPrice fill = costModel.price(new BigDecimal("200"), OrderSide.BUY, 1000);

        assertThat(fill.slippage()).isEqualByComparingTo("0.005");
        assertThat(fill.executionPrice()).isEqualByComparingTo("201");
    }
}
