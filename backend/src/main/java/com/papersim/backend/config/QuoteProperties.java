package com.papersim.backend.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "quotes")
@Data
@Validated
public class QuoteProperties {

    @NotNull
    private Duration timeout = Duration.ofSeconds(2);

    private Circuit circuit = new Circuit();

    @Data
    public static class Circuit {
        @Min(1)
        @Max(100)
        private float failureRateThreshold = 50;

        @NotNull
        private Duration waitOpen = Duration.ofSeconds(30);

        @Min(1)
        private int slidingWindowSize = 20;
    }
}
