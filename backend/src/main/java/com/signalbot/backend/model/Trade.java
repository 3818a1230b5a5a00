package com.signalbot.backend.model;

import jakarta.persistence.*;
import lombok.*;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "trades", indexes = {
        @Index(name = "idx_trades_bot_status", columnList = "bot_id,status"),
        @Index(name = "idx_trades_bot_filled", columnList = "bot_id,filled_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class Trade {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "bot_id", nullable = false)
    private Long botId;

    @Column(nullable = false, length = 20)
    private String pair;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private TradeSide side;

    // base currency quantity
    @Column(nullable = false, precision = 28, scale = 10)
    private BigDecimal size;

    @Column(name = "size_usd", nullable = false, precision = 19, scale = 4)
    private BigDecimal sizeUsd;

    // mark price when the order was submitted
    @Column(nullable = false, precision = 28, scale = 10)
    private BigDecimal price;

    @Column(name = "fill_price", precision = 28, scale = 10)
    private BigDecimal fillPrice;

    @Column(precision = 19, scale = 8)
    private BigDecimal fee;

    @Column(name = "order_id", unique = true, length = 100)
    private String orderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private TradeStatus status = TradeStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private Temperature temperature;

    @Column(name = "combined_signal_score")
    private Double combinedSignalScore;

    @Column(name = "signal_scores", length = 4000)
    private String signalScores;

    @Column(name = "realized_pnl", precision = 19, scale = 8)
    private BigDecimal realizedPnl;

    @Column(name = "error_message", length = 512)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    // set only once the broker confirms the fill
    @Column(name = "filled_at")
    private Instant filledAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public void transitionTo(TradeStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                    "Invalid trade transition: %s -> %s for trade %s", status, target, id));
        }
        TradeStatus previous = status;
        status = target;
        updatedAt = at;
        if (target == TradeStatus.COMPLETED) {
            filledAt = at;
        }
        log.info("Trade state transition tradeId={} botId={} orderId={} from={} to={}",
                id, botId, orderId, previous, target);
    }
}
