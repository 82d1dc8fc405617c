package com.papersim.backend.service;

import com.papersim.backend.exception.TradingException;
import com.papersim.backend.model.ExitReason;
import com.papersim.backend.model.PaperAccount;
import com.papersim.backend.model.PaperPosition;
import com.papersim.backend.repository.PaperAccountRepository;
import com.papersim.backend.repository.PaperPositionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Marks one account to fresh quotes, runs its exit rules and recomputes totals, all under the
 * account lock.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PortfolioValuationService {

    private final PaperAccountRepository accountRepository;
    private final PaperPositionRepository positionRepository;
    private final PositionLedger positionLedger;
    private final RiskManagementService riskManagementService;
    private final AccountAggregator accountAggregator;

    /**
     * Positions without an entry in {@code prices} keep their last price and are not evaluated.
     */
    @Transactional
    public ValuationResult applyQuotes(Long accountId, Map<String, BigDecimal> prices) {
        PaperAccount account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> TradingException.accountNotFound(accountId));

        int repriced = 0;
        List<ExitReason> exits = new ArrayList<>();
        for (PaperPosition position : positionRepository.findByAccountId(accountId)) {
            BigDecimal price = prices.get(position.getSymbol());
            if (price == null) {
                continue;
            }
            positionLedger.revalue(position, price);
            position.getRisk().observePrice(price);
            positionRepository.save(position);
            repriced++;

            Optional<ExitReason> exit = riskManagementService.evaluate(position, price);
            if (exit.isPresent()) {
                riskManagementService.executeRiskExit(account, position, exit.get());
                exits.add(exit.get());
            }
        }
        accountAggregator.recompute(account);
        return new ValuationResult(accountId, repriced, exits);
    }

    public record ValuationResult(Long accountId, int repricedPositions, List<ExitReason> riskExits) {}
}
