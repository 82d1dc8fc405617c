package com.papersim.backend.service;

import com.papersim.backend.dto.PlaceOrderRequest;
import com.papersim.backend.market.InMemoryQuoteProvider;
import com.papersim.backend.model.ExitReason;
import com.papersim.backend.model.PaperAccount;
import com.papersim.backend.model.PaperOrder.OrderSide;
import com.papersim.backend.model.PaperOrder.OrderType;
import com.papersim.backend.model.PaperPosition;
import com.papersim.backend.model.PaperTransaction;
import com.papersim.backend.repository.PaperAccountRepository;
import com.papersim.backend.repository.PaperOrderRepository;
import com.papersim.backend.repository.PaperPositionRepository;
import com.papersim.backend.repository.PaperTransactionRepository;
import com.papersim.backend.support.MutableClock;
import com.papersim.backend.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Import(TestClockConfig.class)
class PriceRefreshServiceTest {

    @Autowired
    private PriceRefreshService priceRefreshService;

    @Autowired
    private PaperTradingService paperTradingService;

    @Autowired
    private PaperAccountRepository accountRepository;

    @Autowired
    private PaperOrderRepository orderRepository;

    @Autowired
    private PaperPositionRepository positionRepository;

    @Autowired
    private PaperTransactionRepository transactionRepository;

    @Autowired
    private InMemoryQuoteProvider quoteProvider;

    @Autowired
    private MutableClock clock;

    private Long accountId;

    @BeforeEach
    void setup() {
        transactionRepository.deleteAll();
        orderRepository.deleteAll();
        positionRepository.deleteAll();
        accountRepository.deleteAll();
        quoteProvider.clear();
        clock.setRegularSession();
        accountId = paperTradingService.createAccount(3L, "Refresh", new BigDecimal("100000")).getId();
        quoteProvider.publish("AAPL", new BigDecimal("100"), 1);
        paperTradingService.placeOrder(PlaceOrderRequest.builder()
                .accountId(accountId)
                .symbol("AAPL")
                .orderType(OrderType.MARKET)
                .side(OrderSide.BUY)
                .quantity(10)
                .build());
    }

    private PaperPosition position() {
        return positionRepository.findByAccountIdAndSymbol(accountId, "AAPL").orElseThrow();
    }

    @Test
    void refreshMarksPositionsAndKeepsTotalsConsistent() {
        quoteProvider.publish("AAPL", new BigDecimal("110"), 1);

        priceRefreshService.refreshAll();

        PaperPosition position = position();
        assertThat(position.getCurrentPrice()).isEqualByComparingTo("110");
        assertThat(position.getMarketValue()).isEqualByComparingTo("1100");
        assertThat(position.getUnrealizedPnl()).isEqualByComparingTo("99");
        assertThat(position.getRisk().getPeakPrice()).isEqualByComparingTo("110");
        PaperAccount account = accountRepository.findById(accountId).orElseThrow();
        assertThat(account.getTotalValue())
                .isEqualByComparingTo(account.getAvailableCash().add(position.getMarketValue()));
    }

    @Test
    void missingQuoteKeepsLastPrice() {
        quoteProvider.remove("AAPL");

        PortfolioValuationService.ValuationResult result = priceRefreshService.refreshAccount(accountId);

        assertThat(result.repricedPositions()).isZero();
        assertThat(position().getCurrentPrice()).isEqualByComparingTo("100.1");
    }

    @Test
    void stopLossTakesPriorityOverTakeProfit() {
        paperTradingService.addRiskManagement(accountId, "AAPL", new BigDecimal("90"), new BigDecimal("89"), null);
        quoteProvider.publish("AAPL", new BigDecimal("89"), 1);

        PortfolioValuationService.ValuationResult result = priceRefreshService.refreshAccount(accountId);

        assertThat(result.riskExits()).containsExactly(ExitReason.STOP_LOSS);
        assertThat(positionRepository.findByAccountIdAndSymbol(accountId, "AAPL")).isEmpty();
        List<PaperTransaction> sells = transactionRepository.findByAccountIdAndTypeOrderByTimestampAscIdAsc(accountId, OrderSide.SELL);
        assertThat(sells).hasSize(1);
        assertThat(sells.get(0).getOrderId()).isNull();
        assertThat(sells.get(0).getDescription()).isEqualTo("RISK EXIT: STOP_LOSS - 10 shares of AAPL at $88.91");
        PaperAccount account = accountRepository.findById(accountId).orElseThrow();
        assertThat(account.getTotalValue()).isEqualByComparingTo(account.getAvailableCash());
    }

    @Test
    void trailingStopFollowsRunningMaximum() {
        paperTradingService.addRiskManagement(accountId, "AAPL", null, null, new BigDecimal("5"));

        quoteProvider.publish("AAPL", new BigDecimal("120"), 1);
        assertThat(priceRefreshService.refreshAccount(accountId).riskExits()).isEmpty();
        assertThat(position().getRisk().getPeakPrice()).isEqualByComparingTo("120");

        // 115 is above 120 x 0.95 = 114, and the peak must not fall back to 115
        quoteProvider.publish("AAPL", new BigDecimal("115"), 1);
        assertThat(priceRefreshService.refreshAccount(accountId).riskExits()).isEmpty();
        assertThat(position().getRisk().getPeakPrice()).isEqualByComparingTo("120");

        quoteProvider.publish("AAPL", new BigDecimal("113"), 1);
        assertThat(priceRefreshService.refreshAccount(accountId).riskExits()).containsExactly(ExitReason.TRAILING_STOP);
        assertThat(positionRepository.findByAccountIdAndSymbol(accountId, "AAPL")).isEmpty();
    }

    @Test
    void takeProfitExitsAboveTarget() {
        paperTradingService.addRiskManagement(accountId, "AAPL", null, new BigDecimal("105"), null);
        quoteProvider.publish("AAPL", new BigDecimal("106"), 1);

        priceRefreshService.refreshAll();

        assertThat(positionRepository.findByAccountIdAndSymbol(accountId, "AAPL")).isEmpty();
        assertThat(transactionRepository.findByAccountIdAndTypeOrderByTimestampAscIdAsc(accountId, OrderSide.SELL).get(0)
                .getRealizedPnl()).isPositive();
    }
}
