package com.signalbot.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "pair_positions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PairPosition {

    @Id
    @Column(length = 20)
    private String pair;

    @Column(name = "realized_pnl", nullable = false, precision = 19, scale = 8)
    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    @Column(name = "total_fees", nullable = false, precision = 19, scale = 8)
    @Builder.Default
    private BigDecimal totalFees = BigDecimal.ZERO;

    @Column(name = "buy_count", nullable = false)
    private int buyCount;

    @Column(name = "sell_count", nullable = false)
    private int sellCount;

    @Version
    private Long version;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
