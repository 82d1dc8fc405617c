package com.papersim.backend.market;

import com.papersim.backend.service.MetricsService;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class QuoteServiceTest {

    @Mock
    private MetricsService metricsService;

    private ExecutorService executor;
    private TimeLimiter timeLimiter;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        timeLimiter = TimeLimiter.of("quotes-test", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(100))
                .cancelRunningFuture(true)
                .build());
        circuitBreaker = CircuitBreaker.of("quotes-test", CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private QuoteService service(QuoteProvider provider) {
        return new QuoteService(provider, timeLimiter, circuitBreaker, executor, metricsService);
    }

    private static Optional<Quote> quote(String symbol, String price) {
        return Optional.of(new Quote(symbol, new BigDecimal(price), 1_000, Instant.now()));
    }

    @Test
    void returnsProviderQuote() {
        QuoteService quoteService = service(symbol -> quote(symbol, "101.25"));

        assertThat(quoteService.getPrice("AAPL")).contains(new BigDecimal("101.25"));
        verify(metricsService, never()).recordQuoteFailure();
    }

    @Test
    void slowProviderDegradesToUnavailable() {
        QuoteService quoteService = service(symbol -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return quote(symbol, "10");
        });

        assertThat(quoteService.getQuote("AAPL")).isEmpty();
        verify(metricsService).recordQuoteFailure();
    }

    @Test
    void failingProviderDegradesToUnavailable() {
        QuoteService quoteService = service(symbol -> {
            throw new IllegalStateException("feed down");
        });

        assertThat(quoteService.getQuote("AAPL")).isEmpty();
        verify(metricsService).recordQuoteFailure();
    }

    @Test
    void nonPositivePriceIsIgnored() {
        QuoteService quoteService = service(symbol -> quote(symbol, "0"));

        assertThat(quoteService.getQuote("AAPL")).isEmpty();
    }

    @Test
    void openCircuitStopsCallingProvider() {
        AtomicInteger calls = new AtomicInteger();
        QuoteService quoteService = service(symbol -> {
            calls.incrementAndGet();
            throw new IllegalStateException("feed down");
        });

        quoteService.getQuote("AAPL");
        quoteService.getQuote("AAPL");
        assertThat(quoteService.getQuote("AAPL")).isEmpty();

        assertThat(calls.get()).isEqualTo(2);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        verify(metricsService, times(3)).recordQuoteFailure();
    }

    @Test
    void batchQuoteOmitsUnavailableSymbols() {
        QuoteService quoteService = service(symbol -> "MSFT".equals(symbol) ? Optional.empty() : quote(symbol, "50"));

        Map<String, BigDecimal> prices = quoteService.getPrices(List.of("AAPL", "MSFT"));

        assertThat(prices).containsOnlyKeys("AAPL");
        assertThat(prices.get("AAPL")).isEqualByComparingTo("50");
    }
}
