package com.signalbot.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "bot_signal_history", indexes = {
        @Index(name = "idx_signal_history_bot_ts", columnList = "bot_id,evaluated_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BotSignalHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "bot_id", nullable = false)
    private Long botId;

    @Column(name = "evaluated_at", nullable = false)
    private Instant evaluatedAt;

    @Column(name = "combined_score", nullable = false)
    private double combinedScore;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private SignalAction action;

    private double confidence;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private Temperature temperature;

    @Enumerated(EnumType.STRING)
    @Column(name = "confirmation_state", length = 20)
    private ConfirmationState confirmationState;

    @Column(name = "signal_scores", length = 4000)
    private String signalScores;

    @Column(name = "evaluation_metadata", length = 4000)
    private String evaluationMetadata;

    private Double price;
}
