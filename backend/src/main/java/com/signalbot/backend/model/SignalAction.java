package com.signalbot.backend.model;

public enum SignalAction {
    BUY,
    SELL,
    HOLD;

    public boolean isTrade() {
        return this != HOLD;
    }

    public TradeSide toSide() {
        return switch (this) {
            case BUY -> TradeSide.BUY;
            case SELL -> TradeSide.SELL;
            case HOLD -> throw new IllegalStateException("HOLD has no trade side");
        };
    }
}
