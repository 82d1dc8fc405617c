package com.papersim.backend.config;

import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "scheduler")
@Data
@Validated
public class SchedulerProperties {

    private boolean autoStart = true;

    @NotNull
    private Duration priceRefreshRegular = Duration.ofSeconds(5);

    @NotNull
    private Duration priceRefreshOffHours = Duration.ofSeconds(30);

    @NotNull
    private Duration orderMonitorRegular = Duration.ofSeconds(2);

    @NotNull
    private Duration orderMonitorOffHours = Duration.ofSeconds(10);

    /** Upper bound on how long stop() waits for an in-flight cycle. */
    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(30);
}
