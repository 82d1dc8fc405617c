package com.papersim.backend.market;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Quote feed backed by prices pushed through {@link #publish}. Symbols never published are unavailable.
 */
@Slf4j
public class InMemoryQuoteProvider implements QuoteProvider {

    private final Map<String, Quote> quotes = new ConcurrentHashMap<>();

    @Override
    public Optional<Quote> getQuote(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(quotes.get(symbol.toUpperCase()));
    }

    public void publish(String symbol, BigDecimal price, long volume) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Quote price must be positive");
        }
        String key = symbol.toUpperCase();
        quotes.put(key, new Quote(key, price, volume, Instant.now()));
        log.debug("Published quote {} @ {}", key, price);
    }

    public void remove(String symbol) {
        quotes.remove(symbol.toUpperCase());
    }

    public void clear() {
        quotes.clear();
    }
}
