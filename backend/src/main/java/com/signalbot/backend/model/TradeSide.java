package com.signalbot.backend.model;

public enum TradeSide {
    BUY,
    SELL;

    public static TradeSide fromString(String side) {
        if (side == null || side.isBlank()) {
            throw new IllegalArgumentException("Trade side is required");
        }
        return valueOf(side.trim().toUpperCase());
    }
}
