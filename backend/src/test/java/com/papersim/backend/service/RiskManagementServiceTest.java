package com.papersim.backend.service;

import com.papersim.backend.config.ExecutionProperties;
import com.papersim.backend.exception.TradingErrorCode;
import com.papersim.backend.exception.TradingException;
import com.papersim.backend.model.ExitReason;
import com.papersim.backend.model.PaperAccount;
import com.papersim.backend.model.PaperOrder.OrderSide;
import com.papersim.backend.model.PaperPosition;
import com.papersim.backend.model.RiskParameters;
import com.papersim.backend.repository.PaperAccountRepository;
import com.papersim.backend.repository.PaperPositionRepository;
import com.papersim.backend.util.MoneyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RiskManagementServiceTest {

    @Mock
    private PaperAccountRepository accountRepository;

    @Mock
    private PaperPositionRepository positionRepository;

    @Mock
    private PositionLedger positionLedger;

    @Mock
    private MetricsService metricsService;

    private RiskManagementService riskManagementService;

    @BeforeEach
    void setUp() {
        riskManagementService = new RiskManagementService(accountRepository, positionRepository,
                new ExecutionCostModel(new ExecutionProperties()), positionLedger, metricsService);
    }

    private static PaperPosition position(RiskParameters risk) {
        return PaperPosition.builder()
                .accountId(1L)
                .symbol("AAPL")
                .quantity(10)
                .averagePrice(MoneyUtils.bd("100"))
                .currentPrice(MoneyUtils.bd("100"))
                .risk(risk)
                .build();
    }

    @Test
    void stopLossWinsOverSimultaneousTakeProfit() {
        PaperPosition position = position(RiskParameters.builder()
                .stopLoss(MoneyUtils.bd("90"))
                .takeProfit(MoneyUtils.bd("89"))
                .build());

        assertThat(riskManagementService.evaluate(position, MoneyUtils.bd("89"))).contains(ExitReason.STOP_LOSS);
    }

    @Test
    void takeProfitTriggersAtOrAboveTarget() {
        PaperPosition position = position(RiskParameters.builder().takeProfit(MoneyUtils.bd("120")).build());

        assertThat(riskManagementService.evaluate(position, MoneyUtils.bd("119.99"))).isEmpty();
        assertThat(riskManagementService.evaluate(position, MoneyUtils.bd("120"))).contains(ExitReason.TAKE_PROFIT);
    }

    @Test
    void trailingStopMeasuresFromPeak() {
        PaperPosition position = position(RiskParameters.builder()
                .trailingStopPercent(MoneyUtils.bd("5"))
                .peakPrice(MoneyUtils.bd("120"))
                .build());

        assertThat(riskManagementService.evaluate(position, MoneyUtils.bd("115"))).isEmpty();
        assertThat(riskManagementService.evaluate(position, MoneyUtils.bd("114"))).contains(ExitReason.TRAILING_STOP);
    }

    @Test
    void positionWithoutRulesNeverExits() {
        assertThat(riskManagementService.evaluate(position(null), MoneyUtils.bd("1"))).isEmpty();
    }

    @Test
    void rejectsTrailingPercentOutsideRange() {
        assertThatThrownBy(() -> riskManagementService.addRiskManagement(1L, "AAPL", null, null, MoneyUtils.bd("100")))
                .isInstanceOfSatisfying(TradingException.class,
                        e -> assertThat(e.getCode()).isEqualTo(TradingErrorCode.VALIDATION_ERROR));
        assertThatThrownBy(() -> riskManagementService.addRiskManagement(1L, "AAPL", BigDecimal.ZERO, null, null))
                .isInstanceOfSatisfying(TradingException.class,
                        e -> assertThat(e.getCode()).isEqualTo(TradingErrorCode.VALIDATION_ERROR));
        verifyNoInteractions(accountRepository, positionRepository);
    }

    @Test
    void missingPositionIsReported() {
        when(accountRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(PaperAccount.builder().id(1L).build()));
        when(positionRepository.findByAccountIdAndSymbol(1L, "AAPL")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> riskManagementService.addRiskManagement(1L, "aapl", MoneyUtils.bd("90"), null, null))
                .isInstanceOfSatisfying(TradingException.class,
                        e -> assertThat(e.getCode()).isEqualTo(TradingErrorCode.POSITION_NOT_FOUND));
    }

    @Test
    void riskExitSellsWholePositionWithCosts() {
        PaperAccount account = PaperAccount.builder().id(1L).build();
        PaperPosition position = position(RiskParameters.builder().stopLoss(MoneyUtils.bd("90")).build());
        position.setCurrentPrice(MoneyUtils.bd("89"));

        riskManagementService.executeRiskExit(account, position, ExitReason.STOP_LOSS);

        verify(positionLedger).applyFill(eq(account), isNull(), eq("AAPL"), eq(OrderSide.SELL), eq(10),
                eq(MoneyUtils.bd("88.911")), eq(MoneyUtils.bd("0.99")),
                eq("RISK EXIT: STOP_LOSS - 10 shares of AAPL at $88.91"));
        verify(metricsService).recordRiskExit("STOP_LOSS");
    }
}
