package com.signalbot.backend.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Append-only trail of trading decisions. Trade events carry the trade id and pair so the
 * history of a single order can be read back in sequence.
 */
@Entity
@Table(name = "audit_events", indexes = {
        @Index(name = "idx_audit_events_bot", columnList = "bot_id,created_at"),
        @Index(name = "idx_audit_events_trade", columnList = "trade_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "bot_id")
    private Long botId;

    @Column(name = "trade_id")
    private Long tradeId;

    @Column(length = 20)
    private String pair;

    // trade, scheduler, alert, reconciliation
    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @Column(nullable = false, length = 64)
    private String action;

    @Column(length = 512)
    private String description;

    // JSON
    @Column(length = 4000)
    private String metadata;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
