package com.papersim.backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@EntityListeners(AuditingEntityListener.class)
@Table(name = "paper_orders")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaperOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderType orderType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderSide side;

    @Column(nullable = false)
    private Integer quantity;

    /** Limit price; required for LIMIT and STOP_LIMIT. */
    @Column(precision = 19, scale = 4)
    private BigDecimal price;

    /** Required for STOP and STOP_LIMIT. */
    @Column(precision = 19, scale = 4)
    private BigDecimal stopPrice;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderStatus status;

    @Column(nullable = false)
    private Integer filledQuantity;

    @Column(name = "avg_price", precision = 19, scale = 4)
    private BigDecimal averagePrice;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal commission;

    @Column(length = 500)
    private String notes;

    @Version
    private Long version;

    @Column(nullable = false, updatable = false)
    @CreatedDate
    private LocalDateTime createdAt;

    @Column(nullable = false)
    @LastModifiedDate
    private LocalDateTime updatedAt;

    private LocalDateTime filledAt;

    public boolean isBuy() {
        return side == OrderSide.BUY;
    }

    public enum OrderType { MARKET, LIMIT, STOP, STOP_LIMIT }

    public enum OrderSide { BUY, SELL }
}
