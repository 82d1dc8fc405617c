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
@Table(name = "paper_positions",
        uniqueConstraints = @UniqueConstraint(name = "uk_paper_positions_account_symbol", columnNames = {"account_id", "symbol"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaperPosition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(nullable = false)
    private String symbol;

    @Column(name = "qty", nullable = false)
    private Integer quantity;

    @Column(name = "avg_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal averagePrice;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal currentPrice;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal marketValue;

    @Column(name = "unrealized_pnl", nullable = false, precision = 19, scale = 4)
    private BigDecimal unrealizedPnl;

    @Column(name = "unrealized_pnl_pct", nullable = false, precision = 19, scale = 4)
    private BigDecimal unrealizedPnlPercent;

    @Embedded
    private RiskParameters risk;

    @Column(nullable = false)
    @CreatedDate
    private LocalDateTime entryDate;

    @Column(nullable = false)
    @LastModifiedDate
    private LocalDateTime updatedAt;

    /**
     * Hibernate hands back a null embeddable when every risk column is null.
     */
    public RiskParameters getRisk() {
        if (risk == null) {
            risk = new RiskParameters();
        }
        return risk;
    }
}
