package com.papersim.backend.config;

import com.papersim.backend.market.InMemoryQuoteProvider;
import com.papersim.backend.market.QuoteProvider;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class QuoteResilienceConfig {

    @Bean
    public CircuitBreaker quoteCircuitBreaker(QuoteProperties quoteProperties) {
        QuoteProperties.Circuit circuit = quoteProperties.getCircuit();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(circuit.getFailureRateThreshold())
                .waitDurationInOpenState(circuit.getWaitOpen())
                .slidingWindowSize(circuit.getSlidingWindowSize())
                .build();
        return CircuitBreaker.of("quotes", config);
    }

    @Bean
    public TimeLimiter quoteTimeLimiter(QuoteProperties quoteProperties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(quoteProperties.getTimeout())
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("quotes", config);
    }

    @Bean(name = "quoteExecutor", destroyMethod = "shutdownNow")
    public ExecutorService quoteExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "quote-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Fallback feed used when no external market-data adapter is wired in.
     */
    @Bean
    @ConditionalOnMissingBean(QuoteProvider.class)
    public InMemoryQuoteProvider inMemoryQuoteProvider() {
        return new InMemoryQuoteProvider();
    }
}
