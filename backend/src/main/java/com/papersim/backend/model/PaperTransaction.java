package com.papersim.backend.model;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Append-only cash movement record. Only account deletion removes rows.
 */
@Entity
@EntityListeners(AuditingEntityListener.class)
@Table(name = "paper_transactions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaperTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    /** Null for risk exits, which have no originating order. */
    @Column(name = "order_id")
    private Long orderId;

    @Column(nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "txn_type", nullable = false)
    private PaperOrder.OrderSide type;

    @Column(nullable = false)
    private Integer quantity;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal price;

    /** Signed cash impact including commission: negative for buys. */
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal commission;

    @Column(name = "realized_pnl", precision = 19, scale = 4)
    private BigDecimal realizedPnl;

    @Column(nullable = false, length = 500)
    private String description;

    @Column(name = "executed_at", nullable = false, updatable = false)
    @CreatedDate
    private LocalDateTime timestamp;
}
