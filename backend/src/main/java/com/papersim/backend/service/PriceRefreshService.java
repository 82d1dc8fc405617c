package com.papersim.backend.service;

import com.papersim.backend.market.QuoteService;
import com.papersim.backend.model.PaperPosition;
import com.papersim.backend.repository.PaperAccountRepository;
import com.papersim.backend.repository.PaperPositionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * One price-refresh cycle: quotes are fetched outside any transaction, then each account is repriced
 * and risk-checked in its own transaction. Accounts run concurrently.
 */
@Service
@Slf4j
public class PriceRefreshService {

    private final PaperAccountRepository accountRepository;
    private final PaperPositionRepository positionRepository;
    private final QuoteService quoteService;
    private final PortfolioValuationService valuationService;
    private final MetricsService metricsService;
    private final Executor accountExecutor;

    public PriceRefreshService(PaperAccountRepository accountRepository,
                               PaperPositionRepository positionRepository,
                               QuoteService quoteService,
                               PortfolioValuationService valuationService,
                               MetricsService metricsService,
                               @Qualifier("accountExecutor") Executor accountExecutor) {
        this.accountRepository = accountRepository;
        this.positionRepository = positionRepository;
        this.quoteService = quoteService;
        this.valuationService = valuationService;
        this.metricsService = metricsService;
        this.accountExecutor = accountExecutor;
    }

    /**
     * Refreshes every account and returns once all of them are done. A failing account is logged and
     * skipped.
     */
    public void refreshAll() {
        List<Long> accountIds = accountRepository.findAllIds();
        if (accountIds.isEmpty()) {
            return;
        }
        CompletableFuture<?>[] tasks = accountIds.stream()
                .map(accountId -> CompletableFuture.runAsync(() -> refreshQuietly(accountId), accountExecutor))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(tasks).join();
        log.debug("Price refresh complete for {} accounts", accountIds.size());
    }

    public PortfolioValuationService.ValuationResult refreshAccount(Long accountId) {
        List<String> symbols = positionRepository.findByAccountId(accountId).stream()
                .map(PaperPosition::getSymbol)
                .distinct()
                .toList();
        Map<String, BigDecimal> prices = quoteService.getPrices(symbols);
        if (prices.size() < symbols.size()) {
            log.debug("Account {}: {} of {} symbols quoted, the rest keep their last price",
                    accountId, prices.size(), symbols.size());
        }
        return valuationService.applyQuotes(accountId, prices);
    }

    private void refreshQuietly(Long accountId) {
        try {
            refreshAccount(accountId);
        } catch (Exception e) {
            metricsService.recordCycleFailure();
            log.error("Price refresh failed for account {}", accountId, e);
        }
    }
}
