package com.papersim.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskParameters {

    @Column(name = "stop_loss", precision = 19, scale = 4)
    private BigDecimal stopLoss;

    @Column(name = "take_profit", precision = 19, scale = 4)
    private BigDecimal takeProfit;

    /** Percent below the peak, e.g. 5 means exit 5% under the highest price seen. */
    @Column(name = "trailing_stop_pct", precision = 19, scale = 4)
    private BigDecimal trailingStopPercent;

    /** Running maximum of every price observed since entry. Only ever moves up. */
    @Column(name = "peak_price", precision = 19, scale = 4)
    private BigDecimal peakPrice;

    public boolean hasExitRules() {
        return stopLoss != null || takeProfit != null || trailingStopPercent != null;
    }

    public void observePrice(BigDecimal price) {
        if (price == null) {
            return;
        }
        if (peakPrice == null || price.compareTo(peakPrice) > 0) {
            peakPrice = price;
        }
    }
}
