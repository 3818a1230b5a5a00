package com.signalbot.backend.model;

/**
 * Trade lifecycle. A trade leaves PENDING exactly once and never moves after that.
 */
public enum TradeStatus {
    PENDING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(TradeStatus target) {
        if (target == null) return false;
        return this == PENDING && target != PENDING;
    }

    public static TradeStatus fromBrokerStatus(String status) {
        if (status == null || status.isBlank()) {
            return PENDING;
        }
        return switch (status.trim().toUpperCase()) {
            case "FILLED", "DONE", "SETTLED", "COMPLETE", "COMPLETED" -> COMPLETED;
            case "CANCELLED", "CANCELED", "EXPIRED" -> CANCELLED;
            case "REJECTED", "FAILED" -> FAILED;
            default -> PENDING;
        };
    }
}
