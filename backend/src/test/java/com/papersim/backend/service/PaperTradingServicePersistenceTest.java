package com.papersim.backend.service;

import com.papersim.backend.exception.TradingErrorCode;
import com.papersim.backend.exception.TradingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PaperTradingServicePersistenceTest {

    @Mock
    private PaperAccountService accountService;

    @Mock
    private PaperOrderExecutionService orderExecutionService;

    @Mock
    private RiskManagementService riskManagementService;

    @Mock
    private MarketSessionService marketSessionService;

    @Mock
    private PaperTradingScheduler scheduler;

    @Mock
    private PortfolioRiskAnalyticsService analyticsService;

    @InjectMocks
    private PaperTradingService paperTradingService;

    @Test
    void storageFailuresSurfaceAsPersistenceErrors() {
        when(accountService.getAccount(1L)).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> paperTradingService.getAccount(1L))
                .isInstanceOfSatisfying(TradingException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(TradingErrorCode.PERSISTENCE_ERROR);
                    assertThat(e.getCause()).isInstanceOf(DataAccessResourceFailureException.class);
                });
    }

    @Test
    void tradingErrorsPassThroughUnchanged() {
        TradingException closed = new TradingException(TradingErrorCode.MARKET_CLOSED, "closed");
        when(orderExecutionService.cancelOrder(3L)).thenThrow(closed);

        assertThatThrownBy(() -> paperTradingService.cancelOrder(3L)).isSameAs(closed);
    }
}
