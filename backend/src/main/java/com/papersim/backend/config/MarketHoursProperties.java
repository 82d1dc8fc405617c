package com.papersim.backend.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * US equity session boundaries. Times are HH:mm in {@link #timezone}; holidays are MM-dd.
 */
@Configuration
@ConfigurationProperties(prefix = "market")
@Data
@Validated
public class MarketHoursProperties {

    @NotBlank
    private String timezone = "America/New_York";

    @NotBlank
    private String preMarketStart = "04:00";

    @NotBlank
    private String regularStart = "09:30";

    @NotBlank
    private String regularEnd = "16:00";

    @NotBlank
    private String afterHoursEnd = "20:00";

    private List<String> holidays = new ArrayList<>(List.of("01-01", "07-04", "12-25"));
}
