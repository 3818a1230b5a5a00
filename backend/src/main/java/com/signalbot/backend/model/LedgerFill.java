package com.signalbot.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "ledger_fills")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerFill {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "fill_id", nullable = false, unique = true, length = 100)
    private String fillId;

    @Column(nullable = false, length = 20)
    private String pair;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private TradeSide side;

    @Column(nullable = false, precision = 28, scale = 10)
    private BigDecimal quantity;

    @Column(nullable = false, precision = 28, scale = 10)
    private BigDecimal price;

    @Column(precision = 19, scale = 8)
    private BigDecimal fee;

    @Column(name = "realized_pnl", precision = 19, scale = 8)
    private BigDecimal realizedPnl;

    @Column(name = "filled_at", nullable = false)
    private Instant filledAt;
}
