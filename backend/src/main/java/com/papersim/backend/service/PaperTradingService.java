package com.papersim.backend.service;

import com.papersim.backend.dto.PaperAccountOverview;
import com.papersim.backend.dto.PlaceOrderRequest;
import com.papersim.backend.exception.TradingErrorCode;
import com.papersim.backend.exception.TradingException;
import com.papersim.backend.model.PaperAccount;
import com.papersim.backend.model.PaperOrder;
import com.papersim.backend.model.PaperPosition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point for callers of the simulation engine. Every failure surfaces as a
 * {@link TradingException}; storage failures are reported as {@link TradingErrorCode#PERSISTENCE_ERROR}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PaperTradingService {

    private final PaperAccountService accountService;
    private final PaperOrderExecutionService orderExecutionService;
    private final RiskManagementService riskManagementService;
    private final MarketSessionService marketSessionService;
    private final PaperTradingScheduler scheduler;
    private final PortfolioRiskAnalyticsService analyticsService;

    public PaperAccount createAccount(Long ownerId, String name, BigDecimal initialBalance) {
        return translate("createAccount", () -> accountService.createAccount(ownerId, name, initialBalance));
    }

    public PaperAccountOverview getAccount(Long accountId) {
        return translate("getAccount", () -> accountService.getAccount(accountId));
    }

    public List<PaperAccount> getAccounts(Long ownerId) {
        return translate("getAccounts", () -> accountService.getAccounts(ownerId));
    }

    public void deleteAccount(Long accountId) {
        translate("deleteAccount", () -> {
            accountService.deleteAccount(accountId);
            return null;
        });
    }

    public PaperOrder placeOrder(PlaceOrderRequest request) {
        return translate("placeOrder", () -> orderExecutionService.placeOrder(request));
    }

    public PaperOrder cancelOrder(Long orderId) {
        return translate("cancelOrder", () -> orderExecutionService.cancelOrder(orderId));
    }

    public PaperPosition addRiskManagement(Long accountId, String symbol, BigDecimal stopLoss,
                                           BigDecimal takeProfit, BigDecimal trailingStopPercent) {
        return translate("addRiskManagement", () -> riskManagementService.addRiskManagement(accountId, symbol,
                stopLoss, takeProfit, trailingStopPercent));
    }

    public MarketSessionService.MarketSession getMarketSession() {
        return marketSessionService.getMarketSession();
    }

    public void startScheduler() {
        scheduler.start();
    }

    public void stopScheduler() {
        scheduler.stop();
    }

    public boolean isSchedulerRunning() {
        return scheduler.isRunning();
    }

    public PortfolioRiskAnalyticsService.TradingStats getTradingStats(Long accountId) {
        return translate("getTradingStats", () -> analyticsService.getTradingStats(accountId));
    }

    public PortfolioRiskAnalyticsService.RiskMetrics getRiskMetrics(Long accountId) {
        return translate("getRiskMetrics", () -> analyticsService.getRiskMetrics(accountId));
    }

    private <T> T translate(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("Persistence failure during {}", operation, e);
            throw new TradingException(TradingErrorCode.PERSISTENCE_ERROR,
                    "Storage failure during " + operation + ": " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
