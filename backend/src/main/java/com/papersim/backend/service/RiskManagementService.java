package com.papersim.backend.service;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * Per-position exit rules: stop-loss, take-profit and a trailing stop measured from the running peak.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RiskManagementService {

    private final PaperAccountRepository accountRepository;
    private final PaperPositionRepository positionRepository;
    private final ExecutionCostModel costModel;
    private final PositionLedger positionLedger;
    private final MetricsService metricsService;

    /**
     * Replaces the exit rules of a position. Passing all three as null clears them. The peak is kept.
     */
    @Transactional
    public PaperPosition addRiskManagement(Long accountId, String symbol, BigDecimal stopLoss,
                                           BigDecimal takeProfit, BigDecimal trailingStopPercent) {
        if (stopLoss != null && stopLoss.signum() <= 0) {
            throw TradingException.validation("Stop loss must be greater than zero");
        }
        if (takeProfit != null && takeProfit.signum() <= 0) {
            throw TradingException.validation("Take profit must be greater than zero");
        }
        if (trailingStopPercent != null
                && (trailingStopPercent.signum() <= 0 || trailingStopPercent.compareTo(MoneyUtils.HUNDRED) >= 0)) {
            throw TradingException.validation("Trailing stop percent must be between 0 and 100");
        }
        if (symbol == null || symbol.isBlank()) {
            throw TradingException.validation("Symbol is required");
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);

        accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> TradingException.accountNotFound(accountId));
        PaperPosition position = positionRepository.findByAccountIdAndSymbol(accountId, normalized)
                .orElseThrow(() -> new TradingException(TradingErrorCode.POSITION_NOT_FOUND,
                        "Position not found for " + normalized));

        RiskParameters risk = position.getRisk();
        risk.setStopLoss(stopLoss == null ? null : MoneyUtils.scale(stopLoss));
        risk.setTakeProfit(takeProfit == null ? null : MoneyUtils.scale(takeProfit));
        risk.setTrailingStopPercent(trailingStopPercent == null ? null : MoneyUtils.scale(trailingStopPercent));
        risk.observePrice(position.getCurrentPrice());
        log.info("Risk rules for {} on account {}: stopLoss={} takeProfit={} trailing={}%",
                normalized, accountId, risk.getStopLoss(), risk.getTakeProfit(), risk.getTrailingStopPercent());
        return positionRepository.save(position);
    }

    /**
     * First matching rule wins: stop-loss, then take-profit, then trailing stop. The peak must already
     * include {@code price}.
     */
    public Optional<ExitReason> evaluate(PaperPosition position, BigDecimal price) {
        RiskParameters risk = position.getRisk();
        if (price == null || !risk.hasExitRules()) {
            return Optional.empty();
        }
        if (risk.getStopLoss() != null && price.compareTo(risk.getStopLoss()) <= 0) {
            return Optional.of(ExitReason.STOP_LOSS);
        }
        if (risk.getTakeProfit() != null && price.compareTo(risk.getTakeProfit()) >= 0) {
            return Optional.of(ExitReason.TAKE_PROFIT);
        }
        if (risk.getTrailingStopPercent() != null && risk.getPeakPrice() != null) {
            BigDecimal keep = BigDecimal.ONE.subtract(MoneyUtils.divide(risk.getTrailingStopPercent(), MoneyUtils.HUNDRED));
            BigDecimal trigger = MoneyUtils.multiply(risk.getPeakPrice(), keep);
            if (price.compareTo(trigger) <= 0) {
                return Optional.of(ExitReason.TRAILING_STOP);
            }
        }
        return Optional.empty();
    }

    /**
     * Sells the whole position at its current price with slippage and commission. Caller holds the
     * account lock.
     */
    public PositionLedger.FillResult executeRiskExit(PaperAccount account, PaperPosition position, ExitReason reason) {
        int quantity = position.getQuantity();
        ExecutionCostModel.FillPrice fill = costModel.price(position.getCurrentPrice(), OrderSide.SELL, quantity);
        String description = "RISK EXIT: " + reason + " - " + quantity + " shares of " + position.getSymbol()
                + " at " + MoneyUtils.usd(fill.executionPrice());
        PositionLedger.FillResult result = positionLedger.applyFill(account, null, position.getSymbol(),
                OrderSide.SELL, quantity, fill.executionPrice(), fill.commission(), description);
        metricsService.recordRiskExit(reason.name());
        log.info("{} on account {}", description, account.getId());
        return result;
    }
}
