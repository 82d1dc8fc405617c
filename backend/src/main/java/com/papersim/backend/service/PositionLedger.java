package com.papersim.backend.service;

import com.papersim.backend.exception.TradingErrorCode;
import com.papersim.backend.exception.TradingException;
import com.papersim.backend.model.PaperAccount;
import com.papersim.backend.model.PaperOrder.OrderSide;
import com.papersim.backend.model.PaperPosition;
import com.papersim.backend.model.PaperTransaction;
import com.papersim.backend.model.RiskParameters;
import com.papersim.backend.repository.PaperAccountRepository;
import com.papersim.backend.repository.PaperPositionRepository;
import com.papersim.backend.repository.PaperTransactionRepository;
import com.papersim.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Applies fills to an account's cash and positions and appends the matching transaction record.
 * Callers must hold the account row lock inside an open transaction.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PositionLedger {

    private final PaperAccountRepository accountRepository;
    private final PaperPositionRepository positionRepository;
    private final PaperTransactionRepository transactionRepository;

    /**
     * Moves cash by {@code -(notional + commission)} on buys and {@code notional - commission} on sells,
     * updates the position, and records the transaction.
     *
     * @param orderId originating order, null for system-initiated exits
     */
    public FillResult applyFill(PaperAccount account, Long orderId, String symbol, OrderSide side, int quantity,
                                BigDecimal executionPrice, BigDecimal commission, String description) {
        if (quantity <= 0) {
            throw TradingException.validation("Fill quantity must be greater than zero");
        }
        BigDecimal notional = MoneyUtils.multiply(executionPrice, quantity);
        Optional<PaperPosition> existing = positionRepository.findByAccountIdAndSymbol(account.getId(), symbol);

        PaperPosition position;
        BigDecimal cashImpact;
        BigDecimal realizedPnl = null;
        if (side == OrderSide.BUY) {
            position = applyBuy(account, existing.orElse(null), symbol, quantity, executionPrice, notional);
            cashImpact = MoneyUtils.add(notional, commission).negate();
        } else {
            PaperPosition held = existing.orElseThrow(() -> new TradingException(TradingErrorCode.INSUFFICIENT_SHARES,
                    "Insufficient shares. Required: " + quantity + ", Available: 0"));
            BigDecimal costBasis = MoneyUtils.multiply(held.getAveragePrice(), quantity);
            realizedPnl = MoneyUtils.subtract(MoneyUtils.subtract(notional, costBasis), commission);
            position = applySell(held, quantity).orElse(null);
            cashImpact = MoneyUtils.subtract(notional, commission);
        }
        account.setAvailableCash(MoneyUtils.add(account.getAvailableCash(), cashImpact));
        accountRepository.save(account);

        PaperTransaction transaction = transactionRepository.save(PaperTransaction.builder()
                .accountId(account.getId())
                .orderId(orderId)
                .symbol(symbol)
                .type(side)
                .quantity(quantity)
                .price(executionPrice)
                .amount(cashImpact)
                .commission(MoneyUtils.scale(commission))
                .realizedPnl(realizedPnl)
                .description(description)
                .build());
        return new FillResult(position, transaction);
    }

    private PaperPosition applyBuy(PaperAccount account, PaperPosition position, String symbol, int quantity,
                                   BigDecimal executionPrice, BigDecimal notional) {
        if (position == null) {
            position = PaperPosition.builder()
                    .accountId(account.getId())
                    .symbol(symbol)
                    .quantity(quantity)
                    .averagePrice(executionPrice)
                    .currentPrice(executionPrice)
                    .marketValue(notional)
                    .unrealizedPnl(MoneyUtils.ZERO)
                    .unrealizedPnlPercent(MoneyUtils.ZERO)
                    .risk(RiskParameters.builder().peakPrice(executionPrice).build())
                    .build();
            log.debug("Opened position {} x{} @ {} for account {}", symbol, quantity, executionPrice, account.getId());
            return positionRepository.save(position);
        }
        int newQty = position.getQuantity() + quantity;
        BigDecimal costBasis = MoneyUtils.add(MoneyUtils.multiply(position.getAveragePrice(), position.getQuantity()), notional);
        position.setQuantity(newQty);
        position.setAveragePrice(MoneyUtils.divide(costBasis, BigDecimal.valueOf(newQty)));
        position.getRisk().observePrice(executionPrice);
        revalue(position, position.getCurrentPrice());
        return positionRepository.save(position);
    }

    private Optional<PaperPosition> applySell(PaperPosition position, int quantity) {
        if (position.getQuantity() < quantity) {
            throw new TradingException(TradingErrorCode.INSUFFICIENT_SHARES,
                    "Insufficient shares. Required: " + quantity + ", Available: " + position.getQuantity());
        }
        int newQty = position.getQuantity() - quantity;
        if (newQty == 0) {
            positionRepository.delete(position);
            log.debug("Closed position {} for account {}", position.getSymbol(), position.getAccountId());
            return Optional.empty();
        }
        position.setQuantity(newQty);
        revalue(position, position.getCurrentPrice());
        return Optional.of(positionRepository.save(position));
    }

    /**
     * Marks a position to {@code price}: market value, unrealized P&L and its percent of cost.
     */
    public void revalue(PaperPosition position, BigDecimal price) {
        BigDecimal marketValue = MoneyUtils.multiply(price, position.getQuantity());
        BigDecimal costBasis = MoneyUtils.multiply(position.getAveragePrice(), position.getQuantity());
        BigDecimal unrealized = MoneyUtils.subtract(marketValue, costBasis);
        position.setCurrentPrice(MoneyUtils.scale(price));
        position.setMarketValue(marketValue);
        position.setUnrealizedPnl(unrealized);
        position.setUnrealizedPnlPercent(MoneyUtils.percentOf(unrealized, costBasis));
    }

    /**
     * @param position the position after the fill, null when a sell closed it
     */
    public record FillResult(PaperPosition position, PaperTransaction transaction) {

        public boolean positionClosed() {
            return position == null;
        }
    }
}
