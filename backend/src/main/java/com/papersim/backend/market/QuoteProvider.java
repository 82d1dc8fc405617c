package com.papersim.backend.market;

import java.util.Optional;

/**
 * Source of the best available current price for a symbol. Staleness is not guaranteed.
 * An empty result means "not available right now"; callers defer rather than fail.
 */
public interface QuoteProvider {

    Optional<Quote> getQuote(String symbol);
}
