package com.papersim.backend.service;

import com.papersim.backend.exception.TradingException;
import com.papersim.backend.model.PaperAccount;
import com.papersim.backend.model.PaperOrder;
import com.papersim.backend.model.PaperTransaction;
import com.papersim.backend.repository.PaperAccountRepository;
import com.papersim.backend.repository.PaperPositionRepository;
import com.papersim.backend.repository.PaperTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Account statistics and heuristic risk figures.
 * <p>
 * The risk metrics are illustrative: they are derived from the account's current P&L only, not from
 * a return series, and must not be read as real portfolio analytics.
 */
@Service
@RequiredArgsConstructor
public class PortfolioRiskAnalyticsService {

    private static final double RISK_FREE_RATE = 0.02;
    private static final double VAR_95_Z = 1.65;
    private static final double DAYS_PER_YEAR = 365.0;

    private final PaperAccountRepository accountRepository;
    private final PaperPositionRepository positionRepository;
    private final PaperTransactionRepository transactionRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public RiskMetrics getRiskMetrics(Long accountId) {
        PaperAccount account = findAccount(accountId);
        return calculateRiskMetrics(account, (int) positionRepository.countByAccountId(accountId));
    }

    @Transactional(readOnly = true)
    public TradingStats getTradingStats(Long accountId) {
        PaperAccount account = findAccount(accountId);
        List<PaperTransaction> sells = transactionRepository.findByAccountIdAndTypeOrderByTimestampAscIdAsc(accountId,
                PaperOrder.OrderSide.SELL);

        int winning = 0;
        int losing = 0;
        double totalWins = 0;
        double totalLosses = 0;
        for (PaperTransaction sell : sells) {
            if (sell.getRealizedPnl() == null) {
                continue;
            }
            double pnl = sell.getRealizedPnl().doubleValue();
            if (pnl > 0) {
                winning++;
                totalWins += pnl;
            } else {
                losing++;
                totalLosses += Math.abs(pnl);
            }
        }
        int total = winning + losing;
        double winRate = total > 0 ? winning * 100.0 / total : 0;
        double averageWin = winning > 0 ? totalWins / winning : 0;
        double averageLoss = losing > 0 ? totalLosses / losing : 0;
        double profitFactor = averageLoss > 0 ? averageWin / averageLoss : 0;

        double totalPnl = account.getTotalPnl().doubleValue();
        double initial = account.getInitialBalance().doubleValue();
        double ageYears = Duration.between(account.getCreatedAt(), LocalDateTime.now(clock)).toMinutes()
                / (DAYS_PER_YEAR * 24 * 60);
        double annualized = ageYears > 0 && initial > 0 ? (totalPnl / initial) / ageYears * 100 : 0;

        RiskMetrics risk = calculateRiskMetrics(account, (int) positionRepository.countByAccountId(accountId));
        return new TradingStats(total, winning, losing, round(winRate), round(averageWin), round(averageLoss),
                round(profitFactor), round(risk.maxDrawdown()), round(risk.sharpeRatio()), round(totalPnl),
                round(annualized));
    }

    RiskMetrics calculateRiskMetrics(PaperAccount account, int positionCount) {
        if (positionCount == 0) {
            return RiskMetrics.EMPTY;
        }
        double value = toDouble(account.getTotalValue());
        double pnl = toDouble(account.getTotalPnl());
        double initial = toDouble(account.getInitialBalance());

        double pnlRatio = value != 0 ? pnl / value : 0;
        double volatility = Math.abs(pnlRatio) * 100;
        double beta = pnl > 0 ? 0.8 : 1.2;
        double sharpe = volatility > 0 ? (pnlRatio - RISK_FREE_RATE) / (volatility / 100) : 0;
        double maxDrawdown = initial != 0 ? Math.min(0, pnl / initial) * 100 : 0;
        double var95 = value * (volatility / 100) * VAR_95_Z;
        double correlation = positionCount > 1 ? 0.3 : 0;

        return new RiskMetrics(
                clamp(volatility, 0, 100),
                clamp(beta, 0, 3),
                clamp(sharpe, -3, 3),
                clamp(maxDrawdown, -100, 0),
                Math.max(0, var95),
                clamp(correlation, 0, 1));
    }

    private PaperAccount findAccount(Long accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> TradingException.accountNotFound(accountId));
    }

    private static double toDouble(BigDecimal value) {
        return value == null ? 0 : value.doubleValue();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round(double value) {
        return Math.round(value * 100) / 100.0;
    }

    public record RiskMetrics(double volatility, double beta, double sharpeRatio, double maxDrawdown,
                              double var95, double correlation) {
        public static final RiskMetrics EMPTY = new RiskMetrics(0, 0, 0, 0, 0, 0);
    }

    public record TradingStats(int totalTrades, int winningTrades, int losingTrades, double winRate,
                               double averageWin, double averageLoss, double profitFactor, double maxDrawdown,
                               double sharpeRatio, double totalReturn, double annualizedReturn) {}
}
