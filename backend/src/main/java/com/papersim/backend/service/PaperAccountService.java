package com.papersim.backend.service;

import com.papersim.backend.config.AccountProperties;
import com.papersim.backend.dto.PaperAccountOverview;
import com.papersim.backend.exception.TradingErrorCode;
import com.papersim.backend.exception.TradingException;
import com.papersim.backend.model.OrderStatus;
import com.papersim.backend.model.PaperAccount;
import com.papersim.backend.repository.PaperAccountRepository;
import com.papersim.backend.repository.PaperOrderRepository;
import com.papersim.backend.repository.PaperPositionRepository;
import com.papersim.backend.repository.PaperTransactionRepository;
import com.papersim.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class PaperAccountService {

    private final PaperAccountRepository accountRepository;
    private final PaperPositionRepository positionRepository;
    private final PaperOrderRepository orderRepository;
    private final PaperTransactionRepository transactionRepository;
    private final AccountProperties accountProperties;

    /**
     * @param initialBalance null for the configured default
     */
    @Transactional
    public PaperAccount createAccount(Long ownerId, String name, BigDecimal initialBalance) {
        if (ownerId == null) {
            throw TradingException.validation("Owner id is required");
        }
        if (name == null || name.isBlank()) {
            throw TradingException.validation("Account name is required");
        }
        BigDecimal balance = initialBalance != null ? initialBalance : accountProperties.getDefaultInitialBalance();
        if (balance.compareTo(accountProperties.getMinInitialBalance()) < 0
                || balance.compareTo(accountProperties.getMaxInitialBalance()) > 0) {
            throw TradingException.validation("Initial balance must be between "
                    + MoneyUtils.usd(accountProperties.getMinInitialBalance()) + " and "
                    + MoneyUtils.usd(accountProperties.getMaxInitialBalance()));
        }
        BigDecimal scaled = MoneyUtils.scale(balance);
        PaperAccount account = accountRepository.save(PaperAccount.builder()
                .ownerId(ownerId)
                .name(name.trim())
                .initialBalance(scaled)
                .availableCash(scaled)
                .totalValue(scaled)
                .totalPnl(MoneyUtils.ZERO)
                .totalPnlPercent(MoneyUtils.ZERO)
                .active(true)
                .build());
        log.info("Created paper account {} '{}' for owner {} with {}", account.getId(), account.getName(),
                ownerId, MoneyUtils.usd(scaled));
        return account;
    }

    @Transactional(readOnly = true)
    public PaperAccountOverview getAccount(Long accountId) {
        PaperAccount account = accountRepository.findById(accountId)
                .orElseThrow(() -> TradingException.accountNotFound(accountId));
        return PaperAccountOverview.builder()
                .account(account)
                .positions(positionRepository.findByAccountId(accountId))
                .orders(orderRepository.findByAccountIdOrderByCreatedAtDescIdDesc(accountId))
                .transactions(transactionRepository.findByAccountIdOrderByTimestampDescIdDesc(accountId))
                .build();
    }

    @Transactional(readOnly = true)
    public List<PaperAccount> getAccounts(Long ownerId) {
        return accountRepository.findByOwnerIdOrderByCreatedAtDescIdDesc(ownerId);
    }

    /**
     * Deletes an account and its history. Refused while it still holds positions or pending orders.
     */
    @Transactional
    public void deleteAccount(Long accountId) {
        PaperAccount account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> TradingException.accountNotFound(accountId));
        long positions = positionRepository.countByAccountId(accountId);
        long pending = orderRepository.countByAccountIdAndStatus(accountId, OrderStatus.PENDING);
        if (positions > 0 || pending > 0) {
            throw new TradingException(TradingErrorCode.ACCOUNT_NOT_EMPTY,
                    "Account " + accountId + " still has " + positions + " open positions and "
                            + pending + " pending orders");
        }
        transactionRepository.deleteByAccountId(accountId);
        orderRepository.deleteByAccountId(accountId);
        positionRepository.deleteByAccountId(accountId);
        accountRepository.delete(account);
        log.info("Deleted paper account {}", accountId);
    }
}
