package com.papersim.backend.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "account")
@Data
@Validated
public class AccountProperties {

    @NotNull
    @Positive
    private BigDecimal defaultInitialBalance = new BigDecimal("100000");

    @NotNull
    @Positive
    private BigDecimal minInitialBalance = new BigDecimal("1000");

    @NotNull
    @Positive
    private BigDecimal maxInitialBalance = new BigDecimal("10000000");
}
