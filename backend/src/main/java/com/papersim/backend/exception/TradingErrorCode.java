package com.papersim.backend.exception;

public enum TradingErrorCode {
    VALIDATION_ERROR,
    INSUFFICIENT_FUNDS,
    INSUFFICIENT_SHARES,
    MARKET_CLOSED,
    QUOTE_UNAVAILABLE,
    ACCOUNT_NOT_FOUND,
    ORDER_NOT_FOUND,
    CANNOT_CANCEL,
    POSITION_NOT_FOUND,
    ACCOUNT_NOT_EMPTY,
    PERSISTENCE_ERROR
}
