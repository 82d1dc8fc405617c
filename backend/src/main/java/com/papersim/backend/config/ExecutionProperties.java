package com.papersim.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "execution")
@Data
@Validated
public class ExecutionProperties {

    @Valid
    private Commission commission = new Commission();

    @Valid
    private Slippage slippage = new Slippage();

    @Valid
    private Orders orders = new Orders();

    @Valid
    private Latency latency = new Latency();

    /**
     * Flat two-tier fee: {@code base} below {@code threshold} notional, {@code large} at or above it.
     */
    @Data
    public static class Commission {
        @NotNull
        @PositiveOrZero
        private BigDecimal base = new BigDecimal("0.99");

        @NotNull
        @PositiveOrZero
        private BigDecimal large = new BigDecimal("9.99");

        @NotNull
        @Positive
        private BigDecimal threshold = new BigDecimal("1000");
    }

    @Data
    public static class Slippage {
        @NotNull
        @PositiveOrZero
        private BigDecimal small = new BigDecimal("0.001");

        @NotNull
        @PositiveOrZero
        private BigDecimal medium = new BigDecimal("0.002");

        @NotNull
        @PositiveOrZero
        private BigDecimal large = new BigDecimal("0.005");

        @NotNull
        @Positive
        private BigDecimal mediumThreshold = new BigDecimal("10000");

        @NotNull
        @Positive
        private BigDecimal largeThreshold = new BigDecimal("100000");
    }

    @Data
    public static class Orders {
        @Min(1)
        private int minQuantity = 1;

        @Min(1)
        private int maxQuantity = 1_000_000;

        @NotNull
        @Positive
        @DecimalMax("1.0")
        private BigDecimal maxCashUsage = new BigDecimal("0.95");
    }

    // Simulated gap between trigger detection and the final re-quote
    @Data
    public static class Latency {
        @Min(0)
        private long minMillis = 100;

        @Min(0)
        private long maxMillis = 500;
    }
}
