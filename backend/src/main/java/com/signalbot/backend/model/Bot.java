package com.signalbot.backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "bots")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Bot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Column(nullable = false, length = 20)
    private String pair;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private BotStatus status = BotStatus.STOPPED;

    // JSON list of typed indicator configs, see SignalConfigParser
    @Column(name = "signal_config", length = 4000)
    private String signalConfig;

    @Column(name = "buy_threshold", nullable = false)
    @Builder.Default
    private double buyThreshold = -0.3;

    @Column(name = "sell_threshold", nullable = false)
    @Builder.Default
    private double sellThreshold = 0.3;

    @Column(name = "confirmation_minutes", nullable = false)
    @Builder.Default
    private int confirmationMinutes = 5;

    @Column(name = "cooldown_minutes", nullable = false)
    @Builder.Default
    private int cooldownMinutes = 15;

    @Column(name = "position_size_usd", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal positionSizeUsd = BigDecimal.valueOf(10);

    @Enumerated(EnumType.STRING)
    @Column(name = "min_temperature", length = 10)
    private Temperature minTemperature;

    @Column(name = "current_position_size", nullable = false, precision = 19, scale = 4)
    @Builder.Default
    private BigDecimal currentPositionSize = BigDecimal.ZERO;

    @Column(name = "current_combined_score")
    @Builder.Default
    private Double currentCombinedScore = 0.0;

    @Enumerated(EnumType.STRING)
    @Column(name = "confirmation_state", nullable = false, length = 20)
    @Builder.Default
    private ConfirmationState confirmationState = ConfirmationState.NO_SIGNAL;

    @Enumerated(EnumType.STRING)
    @Column(name = "confirmation_action", length = 10)
    private SignalAction confirmationAction;

    @Column(name = "signal_confirmation_start")
    private Instant signalConfirmationStart;

    @Version
    private Long version;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }
}
