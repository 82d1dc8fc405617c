package com.papersim.backend.dto;

import com.papersim.backend.model.PaperOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Order ticket. Checked field by field by the order engine so each failure maps to its own error code.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderRequest {

    private Long accountId;

    private String symbol;

    private PaperOrder.OrderType orderType;

    private PaperOrder.OrderSide side;

    private Integer quantity;

    /** Limit price. */
    private BigDecimal price;

    private BigDecimal stopPrice;

    private String notes;
}
