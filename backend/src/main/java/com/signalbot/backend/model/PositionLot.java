package com.signalbot.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Open quantity from one buy fill. Lots of a pair are consumed in id order.
 */
@Entity
@Table(name = "position_lots", indexes = {
        @Index(name = "idx_position_lots_pair", columnList = "pair,id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionLot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 20)
    private String pair;

    @Column(nullable = false, precision = 28, scale = 10)
    private BigDecimal quantity;

    // includes the buy fee spread over the lot quantity
    @Column(name = "unit_cost", nullable = false, precision = 28, scale = 10)
    private BigDecimal unitCost;

    @Column(name = "fill_id", nullable = false, length = 100)
    private String fillId;

    @Column(name = "purchase_date", nullable = false)
    private Instant purchaseDate;
}
