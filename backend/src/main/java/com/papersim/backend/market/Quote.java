package com.papersim.backend.market;

import java.math.BigDecimal;
import java.time.Instant;

public record Quote(String symbol, BigDecimal price, long volume, Instant asOf) {}
