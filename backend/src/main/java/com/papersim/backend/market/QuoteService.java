package com.papersim.backend.market;

import com.papersim.backend.service.MetricsService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Bounded access to the {@link QuoteProvider}. A slow, failing or nonsensical feed collapses to an
 * empty result so one bad symbol cannot stall a cycle.
 */
@Service
@Slf4j
public class QuoteService {

    private final QuoteProvider quoteProvider;
    private final TimeLimiter timeLimiter;
    private final CircuitBreaker circuitBreaker;
    private final ExecutorService quoteExecutor;
    private final MetricsService metricsService;

    public QuoteService(QuoteProvider quoteProvider,
                        TimeLimiter quoteTimeLimiter,
                        CircuitBreaker quoteCircuitBreaker,
                        @Qualifier("quoteExecutor") ExecutorService quoteExecutor,
                        MetricsService metricsService) {
        this.quoteProvider = quoteProvider;
        this.timeLimiter = quoteTimeLimiter;
        this.circuitBreaker = quoteCircuitBreaker;
        this.quoteExecutor = quoteExecutor;
        this.metricsService = metricsService;
    }

    public Optional<Quote> getQuote(String symbol) {
        try {
            Optional<Quote> quote = circuitBreaker.executeCallable(() ->
                    timeLimiter.executeFutureSupplier(() -> quoteExecutor.submit(() -> quoteProvider.getQuote(symbol))));
            if (quote == null || quote.isEmpty()) {
                return Optional.empty();
            }
            BigDecimal price = quote.get().price();
            if (price == null || price.signum() <= 0) {
                log.warn("Ignoring non-positive quote for {}: {}", symbol, price);
                return Optional.empty();
            }
            return quote;
        } catch (TimeoutException e) {
            log.warn("Quote provider timed out for {}", symbol);
        } catch (CallNotPermittedException e) {
            log.debug("Quote circuit open, skipping {}", symbol);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while quoting {}", symbol);
        } catch (Exception e) {
            log.warn("Quote provider failed for {}: {}", symbol, e.getMessage());
        }
        metricsService.recordQuoteFailure();
        return Optional.empty();
    }

    public Optional<BigDecimal> getPrice(String symbol) {
        return getQuote(symbol).map(Quote::price);
    }

    /**
     * Prices for every symbol that could be quoted; unavailable symbols are simply absent.
     */
    public Map<String, BigDecimal> getPrices(Collection<String> symbols) {
        Map<String, BigDecimal> prices = new HashMap<>();
        for (String symbol : symbols) {
            getPrice(symbol).ifPresent(price -> prices.put(symbol, price));
        }
        return prices;
    }
}
