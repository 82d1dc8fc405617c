package com.papersim.backend.service;

import com.papersim.backend.model.PaperAccount;
import com.papersim.backend.model.PaperPosition;
import com.papersim.backend.repository.PaperAccountRepository;
import com.papersim.backend.repository.PaperPositionRepository;
import com.papersim.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Keeps {@code totalValue == availableCash + sum(marketValue)} and the P&L fields derived from it.
 * Runs after every cash or position mutation.
 */
@Service
@RequiredArgsConstructor
public class AccountAggregator {

    private final PaperAccountRepository accountRepository;
    private final PaperPositionRepository positionRepository;

    public PaperAccount recompute(PaperAccount account) {
        return recompute(account, positionRepository.findByAccountId(account.getId()));
    }

    public PaperAccount recompute(PaperAccount account, List<PaperPosition> positions) {
        BigDecimal positionValue = positions.stream()
                .map(position -> position.getMarketValue() != null
                        ? position.getMarketValue()
                        : MoneyUtils.multiply(position.getCurrentPrice(), position.getQuantity()))
                .reduce(MoneyUtils.ZERO, MoneyUtils::add);
        BigDecimal totalValue = MoneyUtils.add(account.getAvailableCash(), positionValue);
        BigDecimal totalPnl = MoneyUtils.subtract(totalValue, account.getInitialBalance());

        account.setTotalValue(totalValue);
        account.setTotalPnl(totalPnl);
        account.setTotalPnlPercent(MoneyUtils.percentOf(totalPnl, account.getInitialBalance()));
        return accountRepository.save(account);
    }
}
