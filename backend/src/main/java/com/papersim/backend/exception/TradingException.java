package com.papersim.backend.exception;

/**
 * Raised by the engine for any request it refuses. Callers branch on {@link #getCode()}.
 */
public class TradingException extends RuntimeException {

    private final TradingErrorCode code;

    public TradingException(TradingErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public TradingException(TradingErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public TradingErrorCode getCode() {
        return code;
    }

    public static TradingException validation(String message) {
        return new TradingException(TradingErrorCode.VALIDATION_ERROR, message);
    }

    public static TradingException accountNotFound(Long accountId) {
        return new TradingException(TradingErrorCode.ACCOUNT_NOT_FOUND, "Paper account not found: " + accountId);
    }

    public static TradingException quoteUnavailable(String symbol) {
        return new TradingException(TradingErrorCode.QUOTE_UNAVAILABLE, "Stock data not available for " + symbol);
    }
}
